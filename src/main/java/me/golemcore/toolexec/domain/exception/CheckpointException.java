package me.golemcore.toolexec.domain.exception;

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

import me.golemcore.toolexec.domain.model.ErrorCode;

/**
 * Durable checkpoint could not be written, or no checkpoint could be found or
 * reconstructed for a resume.
 */
public class CheckpointException extends ToolExecutionException {

    private static final long serialVersionUID = 1L;

    public CheckpointException(ErrorCode code, String message) {
        super(code, message);
    }

    public CheckpointException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }

    public static CheckpointException notFound(String message) {
        return new CheckpointException(ErrorCode.CHECKPOINT_NOT_FOUND, message);
    }

    public static CheckpointException writeFailed(String message, Throwable cause) {
        return new CheckpointException(ErrorCode.CHECKPOINT_FAILED, message, cause);
    }
}
