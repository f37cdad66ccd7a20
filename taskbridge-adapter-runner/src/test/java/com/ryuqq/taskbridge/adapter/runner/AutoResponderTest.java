package com.ryuqq.taskbridge.adapter.runner;

import com.ryuqq.taskbridge.core.model.IncomingMessage;
import com.ryuqq.taskbridge.core.model.SessionName;
import com.ryuqq.taskbridge.testkit.fake.FakeProtocolClient;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AutoResponder 테스트.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
class AutoResponderTest {

    private final List<String> sent = new ArrayList<>();
    private final AutoResponder responder = new AutoResponder(
        (session, target, text) -> sent.add(session + "|" + target + "|" + text));

    @Test
    void 템플릿의_sender를_치환() {
        IncomingMessage message = new IncomingMessage(42, 42, "hi", true);

        assertThat(AutoResponder.render("Hello {sender}! ({sender})", message)).isEqualTo("Hello 42! (42)");
        assertThat(AutoResponder.render("No placeholder", message)).isEqualTo("No placeholder");
    }

    @Test
    void 개인_메시지에만_응답() {
        FakeProtocolClient client = new FakeProtocolClient();
        SessionSlot slot = new SessionSlot(SessionName.of("main"));
        responder.enable(slot, client, "Away, {sender}");

        client.deliver(new IncomingMessage(7, -100, "group", false));
        client.deliver(new IncomingMessage(9, 9, "dm", true));

        assertThat(sent).containsExactly("main|9|Away, 9");
    }

    @Test
    void 다시_켜면_이전_등록을_교체() {
        FakeProtocolClient client = new FakeProtocolClient();
        SessionSlot slot = new SessionSlot(SessionName.of("main"));

        responder.enable(slot, client, "first");
        responder.enable(slot, client, "second");
        client.deliver(new IncomingMessage(1, 1, "dm", true));

        assertThat(client.listenerCount()).isEqualTo(1);
        assertThat(sent).containsExactly("main|1|second");
    }

    @Test
    void 제출_실패는_수신_스레드로_전파되지_않음() {
        FakeProtocolClient client = new FakeProtocolClient();
        SessionSlot slot = new SessionSlot(SessionName.of("main"));
        AutoResponder failing = new AutoResponder((session, target, text) -> {
            throw new IllegalStateException("WorkerRuntime is not accepting jobs");
        });
        failing.enable(slot, client, "x");

        client.deliver(new IncomingMessage(1, 1, "dm", true));

        assertThat(slot.isAutoResponding()).isTrue();
    }

    @Test
    void 끄면_리스너가_해제됨() {
        FakeProtocolClient client = new FakeProtocolClient();
        SessionSlot slot = new SessionSlot(SessionName.of("main"));
        responder.enable(slot, client, "x");

        responder.disable(slot);
        responder.disable(slot);

        assertThat(client.listenerCount()).isZero();
        assertThat(slot.isAutoResponding()).isFalse();
    }
}
