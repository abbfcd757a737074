package com.hrkey.rvl.dto;

import java.util.List;

public record QualityReport(
        boolean valid,
        List<QualityIssue> issueCodes
) {
    public QualityReport {
        issueCodes = List.copyOf(issueCodes);
    }

    public static QualityReport of(List<QualityIssue> issues) {
        return new QualityReport(issues.isEmpty(), issues);
    }

    /** 사람이 읽을 수 있는 이슈 메시지 */
    public List<String> issues() {
        return issueCodes.stream().map(QualityIssue::message).toList();
    }

    /** 길이/단어 수 미달 → 호출자에게 TEXT_TOO_SHORT 로 노출되는 경우 */
    public boolean isTooShort() {
        return issueCodes.contains(QualityIssue.EMPTY)
                || issueCodes.contains(QualityIssue.TOO_SHORT)
                || issueCodes.contains(QualityIssue.TOO_FEW_WORDS);
    }

    public enum QualityIssue {
        EMPTY("Text is empty or invalid"),
        TOO_SHORT("Text too short (minimum 20 characters)"),
        TOO_LONG("Text too long (maximum 10,000 characters)"),
        TOO_FEW_WORDS("Text has too few words (minimum 5 words)"),
        EXCESSIVE_REPETITION("Text contains excessive repetition"),
        GIBBERISH("Text contains potential gibberish");

        private final String message;

        QualityIssue(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }
}
