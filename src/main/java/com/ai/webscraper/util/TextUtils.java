package com.ai.webscraper.util;

import java.util.regex.Pattern;

public class TextUtils {

    public static final String TRUNCATION_MARKER = "\n\n[Content truncated...]";

    private static final Pattern MULTIPLE_WHITESPACE = Pattern.compile("\\s+");
    private static final int CHARS_PER_TOKEN = 4;

    /**
     * 공백 정리
     */
    public static String collapseWhitespace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return MULTIPLE_WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * 로그/에러 메시지용 미리보기
     */
    public static String abbreviate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }

    /**
     * maxLength를 넘으면 마지막 태그('>') 또는 문장('.') 경계에서 자르고 표시를 붙인다.
     * 경계가 앞쪽 80% 이내에 있으면 그냥 maxLength에서 자른다.
     */
    public static String truncateAtBoundary(String content, int maxLength) {
        if (content == null || content.length() <= maxLength) {
            return content;
        }

        String truncated = content.substring(0, maxLength);
        int lastTagEnd = truncated.lastIndexOf('>');
        int lastSentenceEnd = truncated.lastIndexOf('.');
        int cutPoint = Math.max(lastTagEnd, lastSentenceEnd) + 1;

        if (cutPoint > maxLength * 0.8) {
            return truncated.substring(0, cutPoint) + TRUNCATION_MARKER;
        }
        return truncated + TRUNCATION_MARKER;
    }

    /**
     * 대략적인 토큰 수 (문자 4개당 1토큰)
     */
    public static int estimateTokens(String content) {
        if (content == null || content.isEmpty()) {
            return 0;
        }
        return (content.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
