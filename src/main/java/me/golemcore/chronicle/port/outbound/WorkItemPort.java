package me.golemcore.chronicle.port.outbound;

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

import me.golemcore.chronicle.domain.model.BugReport;
import me.golemcore.chronicle.domain.model.TodoItem;

import java.time.Instant;
import java.util.List;

/**
 * Completed todos and fixed bugs, the non-knowledge inputs of snippet capture.
 */
public interface WorkItemPort {

    List<TodoItem> findUncapturedCompletedTodos(int limit);

    List<BugReport> findUncapturedFixedBugs(int limit);

    void markTodoCaptured(Long id, Instant at);

    void markBugCaptured(Long id, Instant at);
}
