package com.ffibind.generator.model.target;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class PlatformTargetTest {

    @ParameterizedTest
    @CsvSource({
            "amd64, X86_64",
            "x86_64, X86_64",
            "aarch64, AARCH64",
            "arm64, AARCH64",
            "i686, X86",
            "arm, ARM"
    })
    void testArchFromProperty(String property, PlatformTarget.Arch expected) {
        assertThat(PlatformTarget.archFromProperty(property)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "Linux, LINUX",
            "Windows 11, WINDOWS",
            "Mac OS X, MACOS"
    })
    void testOsFromProperty(String property, PlatformTarget.OperatingSystem expected) {
        assertThat(PlatformTarget.osFromProperty(property)).isEqualTo(expected);
    }

    @Test
    void testUnknownPlatformIsRejected() {
        assertThatThrownBy(() -> PlatformTarget.archFromProperty("sparc"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sparc");
        assertThatThrownBy(() -> PlatformTarget.osFromProperty("Plan 9"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testShortText() {
        PlatformTarget target = PlatformTarget.builder()
                .arch(PlatformTarget.Arch.X86_64)
                .os(PlatformTarget.OperatingSystem.LINUX)
                .pointerWidth(PlatformTarget.PointerWidth.P64)
                .build();

        assertThat(target.getEndian()).isEqualTo(PlatformTarget.Endian.LITTLE);
        assertThat(target.shortText()).isEqualTo("x86_64-linux");
        assertThat(Environment.of(target).shortText()).isEqualTo("x86_64-linux");
        assertThat(Environment.of(target, "5.15").shortText()).isEqualTo("x86_64-linux (5.15)");
    }

    @Test
    void testEnvironmentEquality() {
        PlatformTarget target = PlatformTarget.builder()
                .arch(PlatformTarget.Arch.ARM)
                .os(PlatformTarget.OperatingSystem.LINUX)
                .pointerWidth(PlatformTarget.PointerWidth.P32)
                .build();

        assertThat(Environment.of(target)).isEqualTo(Environment.of(target, null));
        assertThat(Environment.of(target).getLibraryVersion()).isEmpty();
        assertThat(Environment.of(target, "6.2")).isNotEqualTo(Environment.of(target, "5.15"));
        assertThat(Environment.of(target, "6.2").getLibraryVersion()).contains("6.2");
    }
}
