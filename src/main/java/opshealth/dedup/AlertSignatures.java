package opshealth.dedup;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 告警签名 - 对告警文本归一化后计算SHA-256
 * <p>
 * 去掉行首的[时间戳]前缀，合并空白并转小写，因此仅时间戳或空白不同的两行得到相同签名。
 */
public final class AlertSignatures {

    private static final Pattern TIMESTAMP_PREFIX = Pattern.compile("^\\[[^\\]]+\\]\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private AlertSignatures() {
    }

    public static String normalize(String line) {
        String stripped = StringUtils.strip(StringUtils.defaultString(line));
        String message = TIMESTAMP_PREFIX.matcher(stripped).replaceFirst("");
        return WHITESPACE.matcher(message).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }

    public static String of(String line) {
        return DigestUtils.sha256Hex(normalize(line));
    }
}
