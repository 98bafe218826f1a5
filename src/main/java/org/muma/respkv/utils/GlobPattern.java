package org.muma.respkv.utils;

import java.util.regex.Pattern;

/**
 * Redis 风格的 glob 匹配 (KEYS 命令使用)
 * <p>
 * 支持：
 * <ul>
 *     <li>{@code *} 任意长度 (含空)</li>
 *     <li>{@code ?} 任意单个字符</li>
 *     <li>{@code [abc]} / {@code [^abc]} / {@code [a-z]} 字符集合</li>
 *     <li>{@code \x} 转义</li>
 * </ul>
 * 实现方式是翻译成等价的正则。key 以 ISO-8859-1 解码，所以一个字符就是一个字节。
 */
public final class GlobPattern {

    // "*" 不需要正则
    private final Pattern regex;

    private GlobPattern(Pattern regex) {
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        if ("*".equals(glob)) {
            return new GlobPattern(null);
        }
        return new GlobPattern(Pattern.compile(toRegex(glob), Pattern.DOTALL));
    }

    public boolean matches(String input) {
        return regex == null || regex.matcher(input).matches();
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        int n = glob.length();
        for (int i = 0; i < n; i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> {
                    // 连续的 * 合并
                    while (i + 1 < n && glob.charAt(i + 1) == '*') i++;
                    sb.append(".*");
                }
                case '?' -> sb.append('.');
                case '\\' -> {
                    if (i + 1 < n) {
                        appendLiteral(sb, glob.charAt(++i));
                    } else {
                        appendLiteral(sb, c);
                    }
                }
                case '[' -> {
                    int close = findClassEnd(glob, i + 1);
                    if (close < 0) {
                        // 没有闭合的 [ 当作普通字符
                        appendLiteral(sb, c);
                    } else {
                        appendClass(sb, glob, i + 1, close);
                        i = close;
                    }
                }
                default -> appendLiteral(sb, c);
            }
        }
        return sb.toString();
    }

    private static int findClassEnd(String glob, int from) {
        int i = from;
        if (i < glob.length() && glob.charAt(i) == '^') i++;
        for (; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == ']') {
                return i;
            }
        }
        return -1;
    }

    // [from, to) 为方括号内部
    private static void appendClass(StringBuilder sb, String glob, int from, int to) {
        boolean negate = from < to && glob.charAt(from) == '^';
        int i = negate ? from + 1 : from;
        if (i >= to) {
            // [] 不匹配任何字符；[^] 匹配任意字符
            sb.append(negate ? "." : "(?!)");
            return;
        }

        sb.append(negate ? "[^" : "[");
        while (i < to) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < to) {
                c = glob.charAt(++i);
            }
            if (i + 2 < to && glob.charAt(i + 1) == '-') {
                char end = glob.charAt(i + 2);
                if (end == '\\' && i + 3 < to) {
                    end = glob.charAt(i + 3);
                    i++;
                }
                // Redis 允许反向区间 [z-a]
                char lo = (char) Math.min(c, end);
                char hi = (char) Math.max(c, end);
                appendEscaped(sb, lo);
                sb.append('-');
                appendEscaped(sb, hi);
                i += 3;
            } else {
                appendEscaped(sb, c);
                i++;
            }
        }
        sb.append(']');
    }

    private static void appendLiteral(StringBuilder sb, char c) {
        if (Character.isLetterOrDigit(c) && c < 128) {
            sb.append(c);
        } else {
            appendEscaped(sb, c);
        }
    }

    private static void appendEscaped(StringBuilder sb, char c) {
        sb.append("\\x{").append(Integer.toHexString(c)).append('}');
    }
}
