package com.ryuqq.timeguard.core.work;

/**
 * Finding이 가리키는 소스 위치.
 *
 * @param line 줄 번호 (1부터)
 * @param column 열 번호 (1부터)
 * @param file 파일명 (선택, null 가능)
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public record Location(
    int line,
    int column,
    String file
) {

    public Location {
        if (line < 1) {
            throw new IllegalArgumentException("line must be positive (current: " + line + ")");
        }
        if (column < 1) {
            throw new IllegalArgumentException("column must be positive (current: " + column + ")");
        }
    }
}
