package com.ryuqq.timeguard.core.model;

/**
 * Work Function에 전달되는 입력 데이터.
 *
 * <p>코디네이터는 내용을 해석하지 않고 그대로 전달합니다.
 * 일반적으로 분석 대상 컨트랙트 소스 코드가 담깁니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <ul>
 *   <li>null 허용 (빈 입력 가능)</li>
 *   <li>격리 모드에서는 자식 프로세스로 복사되어 전달됨</li>
 * </ul>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public final class WorkInput {

    private final String value;

    private WorkInput(String value) {
        this.value = value;
    }

    /**
     * WorkInput 생성.
     *
     * @param value 입력 값 (null 허용)
     * @return WorkInput 인스턴스
     */
    public static WorkInput of(String value) {
        return new WorkInput(value);
    }

    /**
     * 빈 WorkInput 생성.
     *
     * @return 빈 WorkInput 인스턴스
     */
    public static WorkInput empty() {
        return new WorkInput("");
    }

    /**
     * 입력 값 조회.
     *
     * @return 입력 값 (null 가능)
     */
    public String getValue() {
        return value;
    }

    /**
     * 입력 크기 (문자 수).
     *
     * @return 문자 수, null이면 0
     */
    public int length() {
        return value == null ? 0 : value.length();
    }

    public boolean isEmpty() {
        return value == null || value.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkInput other = (WorkInput) o;
        if (value == null) return other.value == null;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value == null ? 0 : value.hashCode();
    }

    @Override
    public String toString() {
        return "WorkInput{" + (value == null ? "null" : value.length() + " chars") + '}';
    }
}
