package club.ppmc.remote.service;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ExecutionOutputTest {

    @Test
    void capsCapturedBytesAndFlagsTruncation() {
        var output = new ExecutionOutput(5);

        assertThat(output.append("abc".getBytes(US_ASCII), 0, 3)).isEqualTo(3);
        assertThat(output.isTruncated()).isFalse();
        assertThat(output.append("defg".getBytes(US_ASCII), 0, 4)).isEqualTo(2);
        assertThat(output.append("h".getBytes(US_ASCII), 0, 1)).isZero();

        assertThat(new String(output.snapshot(), US_ASCII)).isEqualTo("abcde");
        assertThat(output.isTruncated()).isTrue();
    }

    @Test
    void viewerGetsReplayThenOnlyNewChunks() throws Exception {
        var output = new ExecutionOutput(100);
        output.append("one ".getBytes(US_ASCII), 0, 4);

        ExecutionAttachment attachment = output.attach();
        output.append("two".getBytes(US_ASCII), 0, 3);
        output.finish();

        assertThat(new String(attachment.replay(), US_ASCII)).isEqualTo("one ");
        assertThat(new String(attachment.channel().take(), US_ASCII)).isEqualTo("two");
        assertThat(attachment.channel().take()).isNull();
    }

    @Test
    void attachAfterFinishReturnsClosedChannel() {
        var output = new ExecutionOutput(100);
        output.append("done".getBytes(US_ASCII), 0, 4);
        output.finish();
        output.finish();

        ExecutionAttachment attachment = output.attach();

        assertThat(attachment.channel().isClosed()).isTrue();
        assertThat(new String(attachment.replay(), US_ASCII)).isEqualTo("done");
        assertThat(output.append("x".getBytes(US_ASCII), 0, 1)).isZero();
    }

    @Test
    void detachStopsDeliveryToThatViewer() {
        var output = new ExecutionOutput(100);
        ExecutionAttachment first = output.attach();
        ExecutionAttachment second = output.attach();

        output.detach(first.channel());
        output.append("x".getBytes(US_ASCII), 0, 1);

        assertThat(output.viewerCount()).isEqualTo(1);
        assertThat(first.channel().isClosed()).isTrue();
        assertThat(first.channel().pending()).isZero();
        assertThat(second.channel().pending()).isEqualTo(1);
    }
}
