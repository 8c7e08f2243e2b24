package io.cuid.fingerprint;

import io.cuid.core.CuidException;
import io.cuid.encoding.Base36;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FingerprintDeriverTest {

    @Test
    void shouldCombineProcessAndHostComponents() {
        // "ab": 97 + 98 + 2 + 36 = 233
        var deriver = new FingerprintDeriver(() -> 1L, () -> "ab");

        var fingerprint = deriver.derive();

        assertThat(fingerprint.value()).isEqualTo(Base36.encodeFixed(1296 + 233, 4));
        assertThat(fingerprint.value()).isEqualTo("016h");
    }

    @Test
    void shouldReduceProcessIdModuloTwoDigits() {
        var deriver = new FingerprintDeriver(() -> 1296L + 5, () -> "ab");

        assertThat(deriver.derive().value()).isEqualTo(Base36.encodeFixed(5 * 1296 + 233, 4));
    }

    @Test
    void shouldReduceHostChecksumModuloTwoDigits() {
        var hostname = "a".repeat(20);
        long expectedHost = (97L * 20 + 20 + 36) % 1296;

        assertThat(FingerprintDeriver.hostComponent(hostname)).isEqualTo(expectedHost);
    }

    @Test
    void shouldPadSmallFingerprintsToFourCharacters() {
        var deriver = new FingerprintDeriver(() -> 0L, () -> "ab");

        assertThat(deriver.derive().value()).isEqualTo("006h");
    }

    @Test
    void shouldStayWithinFourCharacters() {
        long largestProcess = 1295L;
        var deriver = new FingerprintDeriver(() -> largestProcess, () -> "zz-some-long-hostname.example.com");

        assertThat(deriver.derive().value()).hasSize(Fingerprint.WIDTH);
        assertThat(FingerprintDeriver.processComponent(largestProcess)).isEqualTo(1295L * 1296);
    }

    @Test
    void shouldBeStableForSameEnvironment() {
        var deriver = new FingerprintDeriver(() -> 4242L, () -> "build-agent-3");

        assertThat(deriver.derive()).isEqualTo(deriver.derive());
    }

    @Test
    void shouldFailWhenHostnameIsMissing() {
        assertThatThrownBy(() -> new FingerprintDeriver(() -> 1L, () -> null).derive())
                .isInstanceOf(CuidException.class)
                .hasMessageContaining("Host name");
        assertThatThrownBy(() -> new FingerprintDeriver(() -> 1L, () -> "  ").derive())
                .isInstanceOf(CuidException.class);
    }

    @Test
    void shouldWrapSourceFailures() {
        var cause = new IllegalStateException("no pid");

        assertThatThrownBy(() -> new FingerprintDeriver(() -> { throw cause; }, () -> "host").derive())
                .isInstanceOf(CuidException.class)
                .hasMessageContaining("process id")
                .hasCause(cause);
    }

    @Test
    void shouldDeriveFromSystemEnvironment() {
        var deriver = new FingerprintDeriver(FingerprintDeriver::currentProcessId, FingerprintDeriver::localHostname);

        var fingerprint = deriver.derive();

        assertThat(fingerprint.value()).hasSize(Fingerprint.WIDTH).matches("[0-9a-z]{4}");
    }
}
