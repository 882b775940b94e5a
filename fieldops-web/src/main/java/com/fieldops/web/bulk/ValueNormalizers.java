package com.fieldops.web.bulk;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 导入单元格的归一化函数。非法取值抛出 IllegalArgumentException。
 */
public final class ValueNormalizers {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-]+");
    private static final Pattern NON_KEY_CHARS = Pattern.compile("[^a-z0-9_]");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private static final Set<String> TRUE_VALUES = Set.of("yes", "y", "true", "1", "sim", "s");
    private static final Set<String> FALSE_VALUES = Set.of("no", "n", "false", "0", "nao", "não");

    private ValueNormalizers() {
    }

    /**
     * 表头归一化：去掉重音，小写，空白和连字符转下划线，只保留 [a-z0-9_]。
     * 例如 "Client Document" 和 "client-document" 都得到 "client_document"。
     */
    public static String normalizeHeader(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String raw = Normalizer.normalize(value, Normalizer.Form.NFKD);
        raw = COMBINING_MARKS.matcher(raw).replaceAll("");
        raw = raw.toLowerCase(Locale.ROOT).trim();
        raw = SEPARATORS.matcher(raw).replaceAll("_");
        return NON_KEY_CHARS.matcher(raw).replaceAll("");
    }

    public static Object text(String value) {
        return value.trim();
    }

    public static Object lowerText(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    public static Object email(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    /** 只保留数字，用于 CPF/CNPJ 等证件号 */
    public static Object digits(String value) {
        return value.replaceAll("\\D", "");
    }

    public static Object bool(String value) {
        String raw = value.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(raw)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(raw)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("不是有效的是/否取值: " + value);
    }

    public static boolean isValidEmail(String value) {
        return value != null && EMAIL.matcher(value).matches();
    }

    public static String yesNo(Boolean value) {
        return Boolean.FALSE.equals(value) ? "no" : "yes";
    }
}
