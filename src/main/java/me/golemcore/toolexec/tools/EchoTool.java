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

import me.golemcore.toolexec.domain.component.NativeTool;
import me.golemcore.toolexec.domain.component.ToolExecutionContext;
import me.golemcore.toolexec.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Returns its {@code message} parameter as {@code echoed}.
 */
@Component
public class EchoTool implements NativeTool {

    @Override
    public String getName() {
        return "echo";
    }

    @Override
    public ToolResult execute(ToolExecutionContext context) {
        Object message = context.getParameters().get("message");
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("echoed", message);
        return ToolResult.success(output);
    }
}
