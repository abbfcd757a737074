package com.hrkey.rvl.verify;

import com.hrkey.rvl.verify.ReferrerTrustPolicy.DomainCategory;
import com.hrkey.rvl.verify.ReferrerTrustPolicy.ReferrerAssessment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReferrerTrustPolicyTest {

    private final ReferrerTrustPolicy policy = new ReferrerTrustPolicy();

    @Nested
    @DisplayName("classifyDomain()")
    class Classify {

        @Test
        @DisplayName("recognizes known disposable and free mail domains")
        void known() {
            assertThat(policy.classifyDomain("mailinator.com")).isEqualTo(DomainCategory.DISPOSABLE);
            assertThat(policy.classifyDomain("gmail.com")).isEqualTo(DomainCategory.FREE_MAIL);
            assertThat(policy.classifyDomain("acme-corp.com")).isEqualTo(DomainCategory.CORPORATE);
        }

        @Test
        @DisplayName("matches subdomains of disposable domains")
        void suffix() {
            assertThat(policy.classifyDomain("inbox.mailinator.com")).isEqualTo(DomainCategory.DISPOSABLE);
            assertThat(policy.classifyDomain("mail.yahoo.com")).isEqualTo(DomainCategory.FREE_MAIL);
        }

        @Test
        @DisplayName("treats one-edit variants of disposable domains as disposable")
        void nearMiss() {
            assertThat(policy.classifyDomain("tempmail.co")).isEqualTo(DomainCategory.DISPOSABLE);
            assertThat(policy.classifyDomain("mailinat0r.com")).isEqualTo(DomainCategory.DISPOSABLE);
        }

        @Test
        @DisplayName("normalizes case and email input")
        void normalize() {
            assertThat(policy.normalizeDomain("Jane.Doe@Mail.ACME.com")).isEqualTo("mail.acme.com");
            assertThat(policy.classifyDomain("GMAIL.COM")).isEqualTo(DomainCategory.FREE_MAIL);
        }
    }

    @Nested
    @DisplayName("assess()")
    class Assess {

        @Test
        @DisplayName("scores missing email as neutral 50")
        void missing() {
            assertThat(policy.assess(null).score()).isEqualTo(50);
            assertThat(policy.assess("  ").score()).isEqualTo(50);
        }

        @Test
        @DisplayName("scores malformed email as 80")
        void malformed() {
            assertThat(policy.assess("not-an-email").score()).isEqualTo(80);
            assertThat(policy.assess("a@b@c.com").score()).isEqualTo(80);
        }

        @Test
        @DisplayName("scores a corporate address as zero risk")
        void corporate() {
            ReferrerAssessment a = policy.assess("maria.lopez@acme-corp.com");
            assertThat(a.score()).isZero();
            assertThat(a.category()).isEqualTo(DomainCategory.CORPORATE);
            assertThat(a.reasons()).isEmpty();
        }

        @Test
        @DisplayName("adds 60 for disposable and 15 for free mail")
        void domainPenalties() {
            assertThat(policy.assess("maria.lopez@tempmail.com").score()).isEqualTo(60);
            assertThat(policy.assess("maria.lopez@gmail.com").score()).isEqualTo(15);
        }

        @Test
        @DisplayName("adds 20 per suspicious pattern")
        void patterns() {
            assertThat(policy.assess("user123456@acme-corp.com").score()).isEqualTo(20);
            assertThat(policy.assess("xy@acme-corp.com").score()).isEqualTo(20);
            assertThat(policy.assess("maria+test@gmail.com").score()).isEqualTo(35);
        }

        @Test
        @DisplayName("caps the score at 100")
        void capped() {
            ReferrerAssessment a = policy.assess("ab12345+fake@mailinator.com");
            assertThat(a.score()).isEqualTo(100);
            assertThat(a.reasons()).hasSize(3);
        }
    }
}
