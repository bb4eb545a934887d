package com.ryuqq.timeguard.adapter.runner.isolation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * 코디네이터 ↔ 자식 프로세스 메시지 코덱.
 *
 * <p><strong>형식:</strong></p>
 * <pre>
 * stdin  (코디네이터 → 단위): {"jobId":"scan-...","workInput":"..."}  (전송 후 stdin 닫힘)
 * stdout (단위 → 코디네이터): @@timeguard {"type":"RESULT","result":{...}}
 *                            @@timeguard {"type":"ERROR","errorCode":"SCAN_ERROR","message":"..."}
 * </pre>
 *
 * <p>접두어가 없는 stdout 줄은 Work Function 자체 출력이며 메시지로 해석하지 않습니다.</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
public final class UnitProtocol {

    /**
     * 메시지 줄 접두어.
     */
    public static final String MESSAGE_PREFIX = "@@timeguard ";

    private final ObjectMapper objectMapper;

    public UnitProtocol() {
        this(new ObjectMapper()
            .setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    /**
     * 생성자 (ObjectMapper 주입).
     *
     * @param objectMapper JSON 매퍼
     * @throws IllegalArgumentException objectMapper가 null인 경우
     */
    public UnitProtocol(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    public byte[] encodeRequest(UnitSpawnRequest request) throws IOException {
        return objectMapper.writeValueAsBytes(request);
    }

    public UnitSpawnRequest decodeRequest(InputStream in) throws IOException {
        return objectMapper.readValue(in, UnitSpawnRequest.class);
    }

    /**
     * 메시지를 접두어가 붙은 한 줄로 인코딩.
     *
     * @param message 메시지
     * @return 줄바꿈 없는 한 줄
     * @throws IOException 직렬화 실패 시
     */
    public String encodeMessage(UnitMessage message) throws IOException {
        return MESSAGE_PREFIX + objectMapper.writeValueAsString(message);
    }

    public boolean isMessageLine(String line) {
        return line != null && line.startsWith(MESSAGE_PREFIX);
    }

    /**
     * 메시지 줄 디코딩.
     *
     * @param line 접두어가 붙은 줄
     * @return 메시지
     * @throws IOException 접두어가 없거나 JSON이 잘못된 경우
     */
    public UnitMessage decodeMessage(String line) throws IOException {
        if (!isMessageLine(line)) {
            throw new IOException("Not a unit message line");
        }
        return objectMapper.readValue(line.substring(MESSAGE_PREFIX.length()), UnitMessage.class);
    }
}
