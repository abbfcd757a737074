package com.hrkey.rvl.util;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}'-]*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextUtils() {}

    /** 공백 기준 단어 수 (구두점 포함 토큰도 1개로 센다) */
    public static int wordCount(String text) {
        if (text == null || text.isBlank()) return 0;
        return WHITESPACE.split(text.strip()).length;
    }

    /** 소문자 단어 토큰 (구두점 제거) */
    public static List<String> words(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) out.add(m.group());
        return out;
    }

    /** minLength 초과 단어만 빈도 집계 (관사/전치사 등 짧은 단어 제외) */
    public static Map<String, Integer> frequencies(List<String> words, int minLength) {
        Map<String, Integer> tf = new LinkedHashMap<>();
        for (String w : words) {
            if (w.length() <= minLength) continue;
            tf.merge(w, 1, Integer::sum);
        }
        return tf;
    }

    public static double clamp(double v, double min, double max) {
        if (Double.isNaN(v)) return min;
        return Math.max(min, Math.min(max, v));
    }

    public static double round(double v, int digits) {
        double scale = Math.pow(10, digits);
        return Math.round(v * scale) / scale;
    }

    /** 로그용 이메일 마스킹: ma***@company.com */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) return null;
        int at = email.indexOf('@');
        if (at < 0) return email.length() <= 2 ? email : email.substring(0, 2) + "***";
        String local = email.substring(0, at);
        String visible = local.length() <= 2 ? local : local.substring(0, 2) + "***";
        return visible + email.substring(at);
    }
}
