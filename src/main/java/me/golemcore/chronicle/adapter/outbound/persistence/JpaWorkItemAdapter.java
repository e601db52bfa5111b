package me.golemcore.chronicle.adapter.outbound.persistence;

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
import me.golemcore.chronicle.domain.model.BugStatus;
import me.golemcore.chronicle.domain.model.TodoItem;
import me.golemcore.chronicle.domain.model.TodoStatus;
import me.golemcore.chronicle.port.outbound.WorkItemPort;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaWorkItemAdapter implements WorkItemPort {

    private final TodoItemRepository todoRepository;
    private final BugReportRepository bugRepository;

    @Override
    public List<TodoItem> findUncapturedCompletedTodos(int limit) {
        return todoRepository.findByStatusAndCapturedAtIsNullOrderByCompletedAtAscIdAsc(TodoStatus.COMPLETED,
                PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public List<BugReport> findUncapturedFixedBugs(int limit) {
        return bugRepository.findByStatusAndCapturedAtIsNullOrderByUpdatedAtAscIdAsc(BugStatus.FIXED,
                PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public void markTodoCaptured(Long id, Instant at) {
        todoRepository.markCaptured(id, at);
    }

    @Override
    public void markBugCaptured(Long id, Instant at) {
        bugRepository.markCaptured(id, at);
    }
}
