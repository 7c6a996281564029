package opshealth.utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 文本文件读取工具
 */
public final class TextFiles {

    private TextFiles() {
    }

    /**
     * 按UTF-8读取全部行，非法字节替换为U+FFFD而不是抛出MalformedInputException
     */
    public static List<String> readLines(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8)
                .lines()
                .collect(Collectors.toList());
    }
}
