package me.golemcore.toolexec.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.component.NativeTool;
import me.golemcore.toolexec.domain.component.ToolExecutionContext;
import me.golemcore.toolexec.domain.component.ToolHandler;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.ProtocolBinding;
import me.golemcore.toolexec.domain.model.ProtocolKind;
import me.golemcore.toolexec.domain.model.ToolManifest;
import me.golemcore.toolexec.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Dispatches native manifests to the {@link NativeTool} bean named by the
 * binding's {@code handler} (or by the tool id when the binding names none).
 */
@Component
@Slf4j
public class NativeToolHandler implements ToolHandler {

    private final Map<String, NativeTool> tools;

    public NativeToolHandler(List<NativeTool> tools) {
        this.tools = tools.stream().collect(Collectors.toMap(NativeTool::getName, Function.identity()));
        log.info("Registered native tools: {}", this.tools.keySet());
    }

    @Override
    public ProtocolKind getProtocol() {
        return ProtocolKind.NATIVE;
    }

    @Override
    public ToolResult execute(ToolManifest manifest, ToolExecutionContext context) throws Exception {
        String name = manifest.getToolId();
        if (manifest.getBinding() instanceof ProtocolBinding.NativeBinding nativeBinding
                && nativeBinding.handler() != null) {
            name = nativeBinding.handler();
        }
        NativeTool tool = tools.get(name);
        if (tool == null) {
            throw new ToolExecutionException(ErrorCode.TOOL_UNAVAILABLE, "No native handler named " + name);
        }
        return tool.execute(context);
    }
}
