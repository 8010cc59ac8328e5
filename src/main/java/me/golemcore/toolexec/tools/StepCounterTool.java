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
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resumable multi-step tool: counts up to {@code steps}, one step per
 * {@code step_delay_ms}, reporting {@code completed_steps} as its state after
 * every step. A resumed attempt continues from the restored step instead of
 * starting over.
 *
 * <p>
 * Parameters: {@code steps} (required), {@code step_delay_ms} (default 1000),
 * {@code macro_every} (save a macro checkpoint every N steps, 0 = never),
 * {@code fail_at_step} (crash at that step on the first attempt, for drills).
 */
@Component
@Slf4j
public class StepCounterTool implements NativeTool {

    static final String STATE_KEY = "completed_steps";

    @Override
    public String getName() {
        return "step-counter";
    }

    @Override
    public ToolResult execute(ToolExecutionContext context) throws InterruptedException {
        Map<String, Object> params = context.getParameters();
        int steps = intParam(params, "steps", 1);
        long delayMs = intParam(params, "step_delay_ms", 1000);
        int macroEvery = intParam(params, "macro_every", 0);
        int failAt = intParam(params, "fail_at_step", 0);

        int start = context.getRestoredState()
                .map(state -> state.get(STATE_KEY))
                .map(value -> ((Number) value).intValue())
                .orElse(0);
        if (start > 0) {
            log.debug("Resuming {} at step {}", context.getInvocationId(), start);
        }

        for (int step = start + 1; step <= steps; step++) {
            if (context.isCancelled()) {
                return ToolResult.failure(ErrorCode.CANCELLED, "Stopped at step " + (step - 1));
            }
            Thread.sleep(delayMs);
            if (step == failAt && context.getAttempt() == 1) {
                throw new IllegalStateException("Simulated crash at step " + step);
            }
            Map<String, Object> state = Map.of(STATE_KEY, step);
            if (macroEvery > 0 && step % macroEvery == 0) {
                context.saveMacro(state);
            } else {
                context.reportState(state);
            }
            context.reportProgress(step * 100 / steps);
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put(STATE_KEY, steps);
        output.put("resumed_from_step", start);
        output.put("attempt", context.getAttempt());
        return ToolResult.success(output);
    }

    private static int intParam(Map<String, Object> params, String name, int defaultValue) {
        Object value = params.get(name);
        return value instanceof Number number ? number.intValue() : defaultValue;
    }
}
