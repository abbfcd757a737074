package com.hrkey.rvl.verify;

import org.apache.commons.text.similarity.LevenshteinDistance;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

/**
 * 추천인 이메일 평판 정책.
 * - 도메인 분류: 정확 매핑(exact) + 서픽스 매핑(suffix, 가장 긴 것 우선)
 * - 일회용 메일 도메인은 편집거리 1 이내 변형(오타 스쿼팅)도 일회용으로 간주
 * - 로컬 파트 패턴(숫자 나열, 1~2자, +test 등) 가산
 *
 * 점수 범위: 0 ~ 100 (높을수록 위험)
 * - 50: 이메일 없음
 * - 80: 형식 오류
 * - +60: 일회용 메일
 * - +15: 무료 메일(개인 계정)
 * - +20: 의심 패턴 1건당
 */
@Component
public class ReferrerTrustPolicy {

    public static final double MISSING_SCORE = 50;
    public static final double MALFORMED_SCORE = 80;
    private static final double DISPOSABLE_PENALTY = 60;
    private static final double FREE_MAIL_PENALTY = 15;
    private static final double PATTERN_PENALTY = 20;

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    /** 의심 패턴 → 사유 (입력 순서대로 평가) */
    private static final Map<Pattern, String> SUSPICIOUS_PATTERNS = new LinkedHashMap<>();

    static {
        SUSPICIOUS_PATTERNS.put(Pattern.compile("\\d{5,}"), "Long digit run in email");
        SUSPICIOUS_PATTERNS.put(Pattern.compile("^[a-z]{1,2}@"), "Very short local part");
        SUSPICIOUS_PATTERNS.put(Pattern.compile("\\+(test|fake|spam)"), "Test/fake alias in email");
    }

    public enum DomainCategory {
        DISPOSABLE,
        FREE_MAIL,
        CORPORATE
    }

    public record ReferrerAssessment(double score, DomainCategory category, List<String> reasons) {
        public ReferrerAssessment {
            reasons = List.copyOf(reasons);
        }
    }

    private final LevenshteinDistance nearMiss = new LevenshteinDistance(1);

    /** 도메인 정확 매핑 */
    private final Map<String, DomainCategory> exactDomains = new HashMap<>();

    /** 도메인 서픽스 매핑 (".mailinator.com" 형태로 관리) */
    private final Map<String, DomainCategory> suffixDomains = new HashMap<>();

    private final Set<String> disposableDomains = new LinkedHashSet<>();

    public ReferrerTrustPolicy() {
        // ===== 일회용 메일 =====
        for (String d : List.of("tempmail.com", "throwaway.email", "10minutemail.com",
                "guerrillamail.com", "mailinator.com", "trashmail.com")) {
            putExact(d, DomainCategory.DISPOSABLE);
            putSuffix(d, DomainCategory.DISPOSABLE);
            disposableDomains.add(d);
        }

        // ===== 무료 메일 (개인 계정이라 회사 검증이 안 됨) =====
        for (String d : List.of("gmail.com", "yahoo.com", "hotmail.com", "outlook.com",
                "aol.com", "icloud.com", "protonmail.com")) {
            putExact(d, DomainCategory.FREE_MAIL);
        }
        putSuffix("yahoo.com", DomainCategory.FREE_MAIL); // mail.yahoo.com 등
    }

    public ReferrerAssessment assess(String email) {
        if (email == null || email.isBlank()) {
            return new ReferrerAssessment(MISSING_SCORE, null, List.of("No referrer email provided"));
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(normalized).matches()) {
            return new ReferrerAssessment(MALFORMED_SCORE, null, List.of("Malformed referrer email"));
        }

        List<String> reasons = new ArrayList<>();
        double score = 0;

        DomainCategory category = classifyDomain(domainOf(normalized));
        if (category == DomainCategory.DISPOSABLE) {
            score += DISPOSABLE_PENALTY;
            reasons.add("Disposable email domain");
        } else if (category == DomainCategory.FREE_MAIL) {
            score += FREE_MAIL_PENALTY;
            reasons.add("Free email provider");
        }

        for (Map.Entry<Pattern, String> e : SUSPICIOUS_PATTERNS.entrySet()) {
            if (e.getKey().matcher(normalized).find()) {
                score += PATTERN_PENALTY;
                reasons.add(e.getValue());
            }
        }

        return new ReferrerAssessment(Math.min(100, score), category, reasons);
    }

    public DomainCategory classifyDomain(String domain) {
        String host = normalizeDomain(domain);
        if (host == null || host.isEmpty()) return DomainCategory.CORPORATE;

        // 1) exact
        DomainCategory ex = exactDomains.get(host);
        if (ex != null) return ex;

        // 2) suffix (가장 긴 것 우선)
        DomainCategory suf = matchLongestSuffix(host);
        if (suf != null) return suf;

        // 3) 일회용 도메인 오타 변형 (mailinat0r.com 등)
        for (String d : disposableDomains) {
            if (nearMiss.apply(host, d) >= 0) return DomainCategory.DISPOSABLE;
        }
        return DomainCategory.CORPORATE;
    }

    /** "user@Mail.Example.com" / "mail.example.com" 모두 받아서 소문자 도메인 반환 */
    public String normalizeDomain(String emailOrDomain) {
        if (emailOrDomain == null || emailOrDomain.isBlank()) return null;
        String raw = emailOrDomain.trim().toLowerCase(Locale.ROOT);
        int at = raw.lastIndexOf('@');
        String host = at >= 0 ? raw.substring(at + 1) : raw;
        while (host.endsWith(".")) host = host.substring(0, host.length() - 1);
        return host;
    }

    // ------------------------ 내부 유틸 ------------------------

    private static String domainOf(String email) {
        return email.substring(email.lastIndexOf('@') + 1);
    }

    private void putExact(String domain, DomainCategory category) {
        exactDomains.put(domain.toLowerCase(Locale.ROOT), category);
    }

    private void putSuffix(String suffix, DomainCategory category) {
        String sfx = suffix.toLowerCase(Locale.ROOT);
        if (!sfx.startsWith(".")) sfx = "." + sfx;
        suffixDomains.put(sfx, category);
    }

    private DomainCategory matchLongestSuffix(String host) {
        DomainCategory best = null;
        int bestLen = -1;
        for (Map.Entry<String, DomainCategory> e : suffixDomains.entrySet()) {
            String sfx = e.getKey();
            if (host.endsWith(sfx) && sfx.length() > bestLen) {
                bestLen = sfx.length();
                best = e.getValue();
            }
        }
        return best;
    }
}
