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
 * Classifier answer for one knowledge item.
 *
 * @param needsChange
 *            whether the current category is wrong
 * @param category
 *            suggested category, meaningful only when {@code needsChange}
 * @param subcategory
 *            optional finer-grained label, informational
 * @param reason
 *            short free-text justification from the model
 */
public record CategoryVerdict(boolean needsChange, String category, String subcategory, String reason) {
}
