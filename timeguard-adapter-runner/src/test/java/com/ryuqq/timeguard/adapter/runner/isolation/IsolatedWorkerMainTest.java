package com.ryuqq.timeguard.adapter.runner.isolation;

import com.ryuqq.timeguard.core.outcome.ErrorCode;
import com.ryuqq.timeguard.testkit.work.ScriptedWork;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * IsolatedWorkerMain 테스트.
 *
 * <p>자식 프로세스를 띄우지 않고 진입점 본문을 스트림으로 직접 실행합니다.</p>
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
class IsolatedWorkerMainTest {

    private final UnitProtocol protocol = new UnitProtocol();
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(stdout, true, StandardCharsets.UTF_8);

    @Test
    void 분석_성공_시_Result_메시지를_출력하고_0으로_종료() throws IOException {
        // when
        int code = IsolatedWorkerMain.run(args(), request("finding R-1"), out);

        // then
        assertThat(code).isEqualTo(IsolatedWorkerMain.EXIT_OK);
        UnitMessage message = singleMessage();
        assertThat(message.type()).isEqualTo(UnitMessage.Type.RESULT);
        assertThat(message.result().findings()).hasSize(1);
    }

    @Test
    void 분석_실패_시_Error_메시지를_출력하고_0으로_종료() throws IOException {
        // when
        int code = IsolatedWorkerMain.run(args(), request("fail boom"), out);

        // then
        assertThat(code).isEqualTo(IsolatedWorkerMain.EXIT_OK);
        UnitMessage message = singleMessage();
        assertThat(message.type()).isEqualTo(UnitMessage.Type.ERROR);
        assertThat(message.errorCode()).isEqualTo(ErrorCode.SCAN_ERROR);
        assertThat(message.message()).isEqualTo("boom");
        assertThat(message.cause()).isEqualTo(IllegalStateException.class.getName());
    }

    @Test
    void 분류된_타임아웃은_코드와_값을_그대로_전달() throws IOException {
        // when
        IsolatedWorkerMain.run(args(), request("fail-classified-timeout 900"), out);

        // then
        UnitMessage message = singleMessage();
        assertThat(message.errorCode()).isEqualTo(ErrorCode.SCAN_TIMEOUT);
        assertThat(message.timeoutMs()).isEqualTo(900);
    }

    @Test
    void 메시지_없는_예외는_워커_기본_문구() throws IOException {
        // when
        IsolatedWorkerMain.run(args(), request("fail"), out);

        // then
        assertThat(singleMessage().message()).isEqualTo(IsolatedWorkerMain.UNKNOWN_ERROR_MESSAGE);
    }

    @Test
    void checked_예외도_Error_메시지로_전달() throws IOException {
        // when
        IsolatedWorkerMain.run(args(), request("fail-checked bad input"), out);

        // then
        UnitMessage message = singleMessage();
        assertThat(message.message()).isEqualTo("bad input");
        assertThat(message.cause()).isEqualTo(Exception.class.getName());
    }

    @Test
    void Error가_발생해도_Error_메시지로_전달하고_0으로_종료() throws IOException {
        // when
        int code = IsolatedWorkerMain.run(args(), request("fail-error stack exhausted"), out);

        // then
        assertThat(code).isEqualTo(IsolatedWorkerMain.EXIT_OK);
        UnitMessage message = singleMessage();
        assertThat(message.errorCode()).isEqualTo(ErrorCode.SCAN_ERROR);
        assertThat(message.message()).isEqualTo("stack exhausted");
        assertThat(message.cause()).isEqualTo(StackOverflowError.class.getName());
    }

    @Test
    void 결과가_null이면_Error_메시지() throws IOException {
        // when
        IsolatedWorkerMain.run(args(), request("return-null"), out);

        // then
        assertThat(singleMessage().message()).isEqualTo("Work function returned no result");
    }

    @Test
    void 인자가_없으면_64() {
        assertThat(IsolatedWorkerMain.run(new String[0], request("ok"), out)).isEqualTo(IsolatedWorkerMain.EXIT_USAGE);
        assertThat(stdout.size()).isZero();
    }

    @Test
    void 클래스를_찾을_수_없으면_64() {
        int code = IsolatedWorkerMain.run(new String[]{"com.example.MissingWork"}, request("ok"), out);

        assertThat(code).isEqualTo(IsolatedWorkerMain.EXIT_USAGE);
    }

    @Test
    void WorkFunction이_아닌_클래스면_64() {
        int code = IsolatedWorkerMain.run(new String[]{"java.lang.StringBuilder"}, request("ok"), out);

        assertThat(code).isEqualTo(IsolatedWorkerMain.EXIT_USAGE);
    }

    @Test
    void 요청을_읽을_수_없으면_65() {
        InputStream garbage = new ByteArrayInputStream("not-json".getBytes(StandardCharsets.UTF_8));

        int code = IsolatedWorkerMain.run(args(), garbage, out);

        assertThat(code).isEqualTo(IsolatedWorkerMain.EXIT_BAD_REQUEST);
        assertThat(stdout.size()).isZero();
    }

    private String[] args() {
        return new String[]{ScriptedWork.class.getName()};
    }

    private InputStream request(String script) {
        try {
            return new ByteArrayInputStream(protocol.encodeRequest(new UnitSpawnRequest("scan-worker-test", script)));
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private UnitMessage singleMessage() throws IOException {
        String[] lines = stdout.toString(StandardCharsets.UTF_8).split("\\R");
        assertThat(lines).hasSize(1);
        return protocol.decodeMessage(lines[0]);
    }
}
