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

package me.golemcore.recall.domain.classifier;

import me.golemcore.recall.domain.model.ClassifiedToolError;
import me.golemcore.recall.domain.model.ToolFailureCategory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies tool error output. Classifiers are tried in order and the first
 * match wins; unmatched errors longer than {@value #MIN_OTHER_LENGTH}
 * characters fall into {@link ToolFailureCategory#OTHER}.
 *
 * <p>
 * The produced pattern has ids, timestamps, URLs and long quoted strings
 * replaced with placeholders so that recurring errors collapse into one record.
 */
public final class ToolErrorClassifier {

    static final int MAX_PATTERN_LENGTH = 200;

    private static final int MIN_ERROR_LENGTH = 5;
    private static final int MIN_OTHER_LENGTH = 20;

    private static final Pattern HEX_ID = Pattern.compile("[0-9a-f]{8,}", Pattern.CASE_INSENSITIVE);
    private static final Pattern TIMESTAMP = Pattern.compile("\\d{10,}");
    private static final Pattern URL = Pattern.compile("https?://\\S+");
    private static final Pattern LONG_STRING = Pattern.compile("[\"'][^\"']{50,}[\"']");

    private static final List<ErrorRule> RULES = List.of(
            new ErrorRule(Pattern.compile("429|rate.?limit|too many requests|quota exceeded|throttl",
                    Pattern.CASE_INSENSITIVE), ToolFailureCategory.RATE_LIMIT,
                    "%s hits rate limits; add delays between calls or reduce batch size."),
            new ErrorRule(Pattern.compile("401|403|unauthorized|forbidden|invalid.*(?:key|token|credential)|auth",
                    Pattern.CASE_INSENSITIVE), ToolFailureCategory.AUTH,
                    "%s auth failure; check API key/token is valid and has required permissions."),
            new ErrorRule(Pattern.compile("timeout|timed?\\s*out|ETIMEDOUT|ECONNRESET|ECONNREFUSED",
                    Pattern.CASE_INSENSITIVE), ToolFailureCategory.TIMEOUT,
                    "%s times out; consider retry with backoff or check if the service is available."),
            new ErrorRule(Pattern.compile("not found|404|ENOENT|no such file|does not exist|cannot find",
                    Pattern.CASE_INSENSITIVE), ToolFailureCategory.NOT_FOUND,
                    "%s target not found; verify path/URL exists before calling."),
            new ErrorRule(Pattern.compile("encoding|unicode|utf|charmap|codec|UnicodeDecodeError|is not recognized",
                    Pattern.CASE_INSENSITIVE), ToolFailureCategory.ENCODING,
                    "%s encoding issue; use an explicit encoding and check the shell's code page."),
            new ErrorRule(Pattern.compile(
                    "invalid.*param|missing.*required|unexpected.*argument|TypeError|ValidationError",
                    Pattern.CASE_INSENSITIVE), ToolFailureCategory.INVALID_PARAMS,
                    "%s parameter error; check required params and types."));

    private ToolErrorClassifier() {
    }

    public static Optional<ClassifiedToolError> classify(String errorText, String toolName) {
        if (errorText == null || errorText.length() < MIN_ERROR_LENGTH) {
            return Optional.empty();
        }

        for (ErrorRule rule : RULES) {
            if (rule.pattern().matcher(errorText).find()) {
                return Optional.of(new ClassifiedToolError(rule.category(), normalizePattern(errorText),
                        String.format(rule.lessonTemplate(), toolName)));
            }
        }

        if (errorText.length() > MIN_OTHER_LENGTH) {
            return Optional.of(new ClassifiedToolError(ToolFailureCategory.OTHER, normalizePattern(errorText),
                    toolName + " failed; review the error and adjust approach."));
        }
        return Optional.empty();
    }

    /**
     * Reduces an error to a stable pattern: first
     * {@value #MAX_PATTERN_LENGTH} characters with high-entropy substrings
     * replaced.
     */
    public static String normalizePattern(String errorText) {
        String head = errorText.length() > MAX_PATTERN_LENGTH ? errorText.substring(0, MAX_PATTERN_LENGTH)
                : errorText;
        String result = HEX_ID.matcher(head).replaceAll("<id>");
        result = TIMESTAMP.matcher(result).replaceAll("<timestamp>");
        result = URL.matcher(result).replaceAll("<url>");
        result = LONG_STRING.matcher(result).replaceAll("\"<long_string>\"");
        return result.trim();
    }

    private record ErrorRule(Pattern pattern, ToolFailureCategory category, String lessonTemplate) {
    }
}
