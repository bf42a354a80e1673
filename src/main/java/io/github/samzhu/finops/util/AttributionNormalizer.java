package io.github.samzhu.finops.util;

import java.net.URI;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * 歸屬欄位正規化工具類。
 *
 * <p>遙測與帳單兩條資料流對同一資源的表示方式不同：
 * <pre>
 * 帳單： /subscriptions/{sub}/resourceGroups/{rg}/providers/.../accounts/store-ai
 * 遙測： https://store-ai.openai.azure.com/openai/deployments/gpt-4o
 * 兩者： store-ai
 * </pre>
 *
 * <p>所有方法皆為純函式，不拋出例外。
 */
public final class AttributionNormalizer {

    /** 缺漏的裝置、門市、資源以此值表示。 */
    public static final String UNKNOWN = "unknown";

    private static final String PATH_PREFIX = "/subscriptions/";
    private static final Set<String> NULL_LIKE = Set.of("", "null", "none", UNKNOWN);

    private AttributionNormalizer() {
        // 工具類不允許實例化
    }

    /**
     * 將資源識別碼轉為標準短名稱。
     *
     * <ul>
     *   <li>{@code null}、空字串、{@code unknown} → {@code unknown}</li>
     *   <li>{@code /subscriptions/...} 路徑 → 最後一個路徑段</li>
     *   <li>{@code http(s)://} URL → 主機名稱的第一段，解析失敗時回傳原字串</li>
     *   <li>其他 → 去除空白並轉小寫</li>
     * </ul>
     *
     * @param raw 原始資源識別碼
     * @return 標準化的資源名稱
     */
    public static String normalizeResourceId(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty() || UNKNOWN.equals(value)) {
            return UNKNOWN;
        }
        if (value.startsWith(PATH_PREFIX)) {
            return lastSegment(value);
        }
        if (value.startsWith("http")) {
            return firstHostLabel(value);
        }
        return value;
    }

    /**
     * 將裝置或門市識別碼正規化，缺漏或類 null 值以 {@link #UNKNOWN} 取代。
     *
     * @param raw 原始值
     * @return 去除空白的值或 {@code unknown}
     */
    public static String normalizeAttribute(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        String value = raw.trim();
        if (NULL_LIKE.contains(value.toLowerCase(Locale.ROOT))) {
            return UNKNOWN;
        }
        return value;
    }

    public static boolean isUnknown(String value) {
        return value == null || UNKNOWN.equals(value);
    }

    /**
     * 解析非負數值欄位。
     *
     * @param raw 文字型數值，例如 {@code "120"}、{@code "45.5"}
     * @return 解析成功且為有限非負數時回傳數值，否則為空
     */
    public static OptionalDouble parseNonNegative(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalDouble.empty();
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) && value >= 0
                ? OptionalDouble.of(value)
                : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static String lastSegment(String path) {
        String[] parts = path.split("/");
        for (int i = parts.length - 1; i >= 0; i--) {
            if (!parts[i].isEmpty()) {
                return parts[i];
            }
        }
        return UNKNOWN;
    }

    private static String firstHostLabel(String url) {
        try {
            String host = URI.create(url).getHost();
            if (host == null || host.isEmpty()) {
                return url;
            }
            int dot = host.indexOf('.');
            return dot > 0 ? host.substring(0, dot) : host;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }
}
