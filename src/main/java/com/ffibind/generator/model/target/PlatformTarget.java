package com.ffibind.generator.model.target;

import java.util.Locale;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Platform a generated wrapper is compiled and run on.
 */
@Value
@Builder(toBuilder = true)
public class PlatformTarget {

    public enum Arch {
        X86,
        X86_64,
        AARCH64,
        ARM
    }

    public enum OperatingSystem {
        LINUX,
        WINDOWS,
        MACOS
    }

    public enum PointerWidth {
        P32,
        P64
    }

    public enum Endian {
        LITTLE,
        BIG
    }

    @NonNull
    Arch arch;

    @NonNull
    OperatingSystem os;

    @NonNull
    PointerWidth pointerWidth;

    @NonNull
    @Builder.Default
    Endian endian = Endian.LITTLE;

    /**
     * Describes the platform the JVM is running on.
     */
    public static PlatformTarget current() {
        Arch arch = archFromProperty(System.getProperty("os.arch", ""));
        OperatingSystem os = osFromProperty(System.getProperty("os.name", ""));
        PointerWidth width = (arch == Arch.X86_64 || arch == Arch.AARCH64) ? PointerWidth.P64 : PointerWidth.P32;
        return PlatformTarget.builder()
                .arch(arch)
                .os(os)
                .pointerWidth(width)
                .build();
    }

    static Arch archFromProperty(String value) {
        String normalized = value.toLowerCase(Locale.ROOT).trim();
        return switch (normalized) {
            case "amd64", "x86_64" -> Arch.X86_64;
            case "aarch64", "arm64" -> Arch.AARCH64;
            case "x86", "i386", "i486", "i586", "i686" -> Arch.X86;
            case "arm", "arm32" -> Arch.ARM;
            default -> throw new IllegalStateException("Unsupported architecture: " + value);
        };
    }

    static OperatingSystem osFromProperty(String value) {
        String normalized = value.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("linux")) {
            return OperatingSystem.LINUX;
        }
        if (normalized.startsWith("windows")) {
            return OperatingSystem.WINDOWS;
        }
        if (normalized.startsWith("mac") || normalized.startsWith("darwin")) {
            return OperatingSystem.MACOS;
        }
        throw new IllegalStateException("Unsupported operating system: " + value);
    }

    /**
     * Compact form such as {@code x86_64-linux}.
     */
    public String shortText() {
        return arch.name().toLowerCase(Locale.ROOT) + "-" + os.name().toLowerCase(Locale.ROOT);
    }
}
