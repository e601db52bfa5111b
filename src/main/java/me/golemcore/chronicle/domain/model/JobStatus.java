package me.golemcore.chronicle.domain.model;

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

/**
 * Ledger status of a scheduled job.
 *
 * <p>
 * Stored transitions are {@code IDLE|COMPLETED|FAILED -> RUNNING -> COMPLETED|FAILED}.
 * {@link #SKIPPED} is what a firing reports when the job was already running;
 * it is logged, never written to the row.
 */
public enum JobStatus {
    IDLE, RUNNING, COMPLETED, FAILED, SKIPPED
}
