package com.ryuqq.contextguard.adapter.yaml;

/**
 * 계약 정의를 읽거나 해석할 수 없을 때 발생하는 예외.
 *
 * <p>파일 누락, YAML 문법 오류, 알 수 없는 키, 필수 키 누락, 잘못된 severity,
 * 해석할 수 없는 검증식 등 작성 오류(authoring error)를 모두 이 예외로 보고합니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public class ContractLoadException extends RuntimeException {

    private final String source;

    /**
     * 생성자.
     *
     * @param source 계약 출처 (파일 경로 또는 {@code <string>})
     * @param detail 상세 사유
     */
    public ContractLoadException(String source, String detail) {
        super(formatMessage(source, detail));
        this.source = source;
    }

    /**
     * 원인 예외를 포함한 생성자.
     *
     * @param source 계약 출처
     * @param detail 상세 사유
     * @param cause 원인 예외
     */
    public ContractLoadException(String source, String detail, Throwable cause) {
        super(formatMessage(source, detail), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    private static String formatMessage(String source, String detail) {
        return "Failed to load contract from " + source + ": " + detail;
    }
}
