package com.ryuqq.timeguard.adapter.runner.isolation;

import com.ryuqq.timeguard.core.work.WorkFunction;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 자식 JVM 실행 단위 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workFunctionClass: 자식에서 생성할 {@link WorkFunction} 구현 클래스 (public 기본 생성자 필요)</li>
 *   <li>javaExecutable: java 실행 파일 경로 (기본: 현재 JVM의 java.home/bin/java)</li>
 *   <li>classpath: 자식 클래스패스 (기본: 현재 JVM의 java.class.path)</li>
 *   <li>jvmOptions: 추가 JVM 옵션 (예: -Xmx256m)</li>
 * </ul>
 *
 * @author Timeguard Team
 * @since 1.0.0
 * @param workFunctionClass Work Function 구현 클래스 이름
 * @param javaExecutable java 실행 파일 경로
 * @param classpath 자식 클래스패스
 * @param jvmOptions JVM 옵션 (null이면 빈 목록)
 */
public record ProcessUnitConfig(
    String workFunctionClass,
    String javaExecutable,
    String classpath,
    List<String> jvmOptions
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 필수 값이 비어있는 경우
     */
    public ProcessUnitConfig {
        if (workFunctionClass == null || workFunctionClass.isBlank()) {
            throw new IllegalArgumentException("workFunctionClass cannot be null or blank");
        }
        if (javaExecutable == null || javaExecutable.isBlank()) {
            throw new IllegalArgumentException("javaExecutable cannot be null or blank");
        }
        if (classpath == null || classpath.isBlank()) {
            throw new IllegalArgumentException("classpath cannot be null or blank");
        }
        jvmOptions = jvmOptions == null ? List.of() : List.copyOf(jvmOptions);
    }

    /**
     * 현재 JVM 기준 기본 설정 생성.
     *
     * @param workFunctionType Work Function 구현 클래스
     * @return ProcessUnitConfig 인스턴스
     * @throws IllegalArgumentException workFunctionType이 null인 경우
     */
    public static ProcessUnitConfig forWorkFunction(Class<? extends WorkFunction> workFunctionType) {
        if (workFunctionType == null) {
            throw new IllegalArgumentException("workFunctionType cannot be null");
        }
        return new ProcessUnitConfig(
            workFunctionType.getName(),
            Path.of(System.getProperty("java.home"), "bin", "java").toString(),
            System.getProperty("java.class.path"),
            List.of()
        );
    }

    /**
     * jvmOptions만 변경한 새 인스턴스 생성.
     */
    public ProcessUnitConfig withJvmOptions(List<String> jvmOptions) {
        return new ProcessUnitConfig(workFunctionClass, javaExecutable, classpath, jvmOptions);
    }

    /**
     * classpath만 변경한 새 인스턴스 생성.
     */
    public ProcessUnitConfig withClasspath(String classpath) {
        return new ProcessUnitConfig(workFunctionClass, javaExecutable, classpath, jvmOptions);
    }

    /**
     * javaExecutable만 변경한 새 인스턴스 생성.
     */
    public ProcessUnitConfig withJavaExecutable(String javaExecutable) {
        return new ProcessUnitConfig(workFunctionClass, javaExecutable, classpath, jvmOptions);
    }

    /**
     * 자식 프로세스 실행 명령.
     *
     * @return java [jvmOptions] -cp classpath IsolatedWorkerMain workFunctionClass
     */
    public List<String> command() {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.addAll(jvmOptions);
        command.add("-cp");
        command.add(classpath);
        command.add(IsolatedWorkerMain.class.getName());
        command.add(workFunctionClass);
        return command;
    }
}
