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
package ru.nts.tools.impact.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Properties;

/**
 * Настройки анализа.
 * <p>
 * Значения по умолчанию можно переопределить переменными окружения
 * (IMPACT_HIGH_REFERENCE_THRESHOLD и т.д.) или системными свойствами JVM
 * (impact.highReferenceThreshold и т.д.). Системное свойство имеет приоритет.
 *
 * @param highReferenceThreshold     больше стольких ссылок повышает medium до high
 * @param criticalReferenceThreshold больше стольких ссылок делает влияние critical
 * @param maxFileBytes               максимальный размер анализируемого текста в байтах
 */
public record AnalysisConfig(
        int highReferenceThreshold,
        int criticalReferenceThreshold,
        long maxFileBytes
) {

    private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

    public static final int DEFAULT_HIGH_REFERENCE_THRESHOLD = 10;
    public static final int DEFAULT_CRITICAL_REFERENCE_THRESHOLD = 50;
    public static final long DEFAULT_MAX_FILE_BYTES = 5L * 1024 * 1024;

    public AnalysisConfig {
        if (highReferenceThreshold < 0 || criticalReferenceThreshold < 0 || maxFileBytes <= 0) {
            throw new IllegalArgumentException("Thresholds must be non-negative and maxFileBytes positive");
        }
    }

    /**
     * Конфигурация по умолчанию, без чтения окружения.
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(
                DEFAULT_HIGH_REFERENCE_THRESHOLD,
                DEFAULT_CRITICAL_REFERENCE_THRESHOLD,
                DEFAULT_MAX_FILE_BYTES);
    }

    /**
     * Читает конфигурацию из переменных окружения и системных свойств процесса.
     */
    public static AnalysisConfig fromEnvironment() {
        return load(System.getenv(), System.getProperties());
    }

    /**
     * Читает конфигурацию из переданных источников.
     * Некорректные значения заменяются значениями по умолчанию.
     */
    public static AnalysisConfig load(Map<String, String> env, Properties properties) {
        int high = (int) Math.min(Integer.MAX_VALUE, readLong(env, properties,
                "IMPACT_HIGH_REFERENCE_THRESHOLD", "impact.highReferenceThreshold",
                DEFAULT_HIGH_REFERENCE_THRESHOLD));
        int critical = (int) Math.min(Integer.MAX_VALUE, readLong(env, properties,
                "IMPACT_CRITICAL_REFERENCE_THRESHOLD", "impact.criticalReferenceThreshold",
                DEFAULT_CRITICAL_REFERENCE_THRESHOLD));
        long maxBytes = readLong(env, properties,
                "IMPACT_MAX_FILE_BYTES", "impact.maxFileBytes",
                DEFAULT_MAX_FILE_BYTES);
        if (maxBytes <= 0) {
            log.warn("Ignoring non-positive max file size {}, using {}", maxBytes, DEFAULT_MAX_FILE_BYTES);
            maxBytes = DEFAULT_MAX_FILE_BYTES;
        }
        return new AnalysisConfig(high, critical, maxBytes);
    }

    private static long readLong(Map<String, String> env, Properties properties,
                                 String envKey, String propertyKey, long defaultValue) {
        String raw = properties != null ? properties.getProperty(propertyKey) : null;
        String source = propertyKey;
        if (raw == null && env != null) {
            raw = env.get(envKey);
            source = envKey;
        }
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < 0) {
                log.warn("Ignoring negative value {}={}, using {}", source, raw, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid value {}={}, using {}", source, raw, defaultValue);
            return defaultValue;
        }
    }
}
