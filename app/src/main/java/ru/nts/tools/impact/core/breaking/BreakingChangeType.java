/*
 * Copyright 2025 Aristo
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
 */
package ru.nts.tools.impact.core.breaking;

/**
 * Типы несовместимых изменений API.
 * {@link #TYPE_CHANGE} и {@link #BEHAVIOR_CHANGE} входят в словарь отчётов,
 * но текущий детектор их не выдаёт.
 */
public enum BreakingChangeType {
    REMOVAL("removal"),
    SIGNATURE_CHANGE("signature_change"),
    TYPE_CHANGE("type_change"),
    VISIBILITY_CHANGE("visibility_change"),
    PARAMETER_CHANGE("parameter_change"),
    RETURN_TYPE_CHANGE("return_type_change"),
    REQUIRED_PARAMETER("required_parameter"),
    BEHAVIOR_CHANGE("behavior_change");

    private final String wireName;

    BreakingChangeType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
