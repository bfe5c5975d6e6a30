package io.rtpi.workspace.workspace;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * CPU / 内存限额字符串解析。
 * <ul>
 *   <li>CPU：十进制核数，如 "2"、"0.5"</li>
 *   <li>内存：数字 + 可选单位，M / Mi（默认，MB），G / Gi（x1024），如 "4096M"、"8Gi"</li>
 * </ul>
 * 无法解析时抛 IllegalArgumentException。
 */
public final class ResourceSizes {

    private ResourceSizes() {
    }

    public static double parseCpu(String cpu) {
        if (cpu == null || cpu.isBlank()) {
            throw new IllegalArgumentException("cpuLimit is required");
        }
        double v;
        try {
            v = Double.parseDouble(cpu.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cpuLimit: " + cpu);
        }
        if (Double.isNaN(v) || Double.isInfinite(v) || v <= 0) {
            throw new IllegalArgumentException("Invalid cpuLimit: " + cpu);
        }
        return v;
    }

    public static long parseMemoryMb(String memory) {
        if (memory == null || memory.isBlank()) {
            throw new IllegalArgumentException("memoryLimit is required");
        }
        String s = memory.trim().toUpperCase(Locale.ROOT);
        long factor = 1;
        if (s.endsWith("GI")) {
            factor = 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("G")) {
            factor = 1024;
            s = s.substring(0, s.length() - 1);
        } else if (s.endsWith("MI")) {
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("M")) {
            s = s.substring(0, s.length() - 1);
        }
        BigDecimal v;
        try {
            v = new BigDecimal(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid memoryLimit: " + memory);
        }
        if (v.signum() <= 0) {
            throw new IllegalArgumentException("Invalid memoryLimit: " + memory);
        }
        // 0.5G -> 512；小数部分向下取整，结果必须落在 [1, Long.MAX_VALUE]
        long mb;
        try {
            mb = v.multiply(BigDecimal.valueOf(factor)).setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Invalid memoryLimit: " + memory);
        }
        if (mb <= 0) {
            throw new IllegalArgumentException("Invalid memoryLimit: " + memory);
        }
        return mb;
    }

    /**
     * 2.0 -> "2"，2.5 -> "2.5"
     */
    public static String formatCpu(double cpu) {
        return BigDecimal.valueOf(cpu).stripTrailingZeros().toPlainString();
    }
}
