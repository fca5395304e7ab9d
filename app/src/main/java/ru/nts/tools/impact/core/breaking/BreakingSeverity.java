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
 * Шкала серьёзности несовместимых изменений: warning &lt; error &lt; critical.
 * Не путать с {@link ru.nts.tools.impact.core.impact.ImpactSeverity}: шкалы независимы.
 */
public enum BreakingSeverity {
    WARNING("warning"),
    ERROR("error"),
    CRITICAL("critical");

    private final String wireName;

    BreakingSeverity(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Ломает ли изменение такой серьёзности вызывающий код (error и critical).
     */
    public boolean isBreaking() {
        return this != WARNING;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
