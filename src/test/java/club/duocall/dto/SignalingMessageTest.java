package club.duocall.dto;

import static org.assertj.core.api.Assertions.assertThat;

import club.duocall.model.ParticipantRole;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class SignalingMessageTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsBrowserStyleCandidateMessage() throws Exception {
        var json = """
                {"type":"ice-candidate","candidate":{"candidate":"candidate:1 1 udp 2122260223 192.168.1.5 54321 typ host",
                 "sdpMid":"0","sdpMLineIndex":0,"usernameFragment":"abcd"}}
                """;

        var message = objectMapper.readValue(json, SignalingMessage.class);

        assertThat(message.type()).isEqualTo(MessageType.ICE_CANDIDATE);
        assertThat(message.candidate().sdpMid()).isEqualTo("0");
        assertThat(message.candidate().sdpMLineIndex()).isZero();
    }

    @Test
    void writesRoomStatusWithWireNames() throws Exception {
        var tree = objectMapper.readTree(objectMapper.writeValueAsString(
                SignalingMessage.roomStatus(2, ParticipantRole.SECOND)));

        assertThat(tree.get("type").asText()).isEqualTo("room_status");
        assertThat(tree.get("count").asInt()).isEqualTo(2);
        assertThat(tree.get("role").asText()).isEqualTo("second");
        assertThat(tree.has("offer")).isFalse();
    }

    @Test
    void unknownTypeReadsAsNull() throws Exception {
        var message = objectMapper.readValue("{\"type\":\"dance\"}", SignalingMessage.class);

        assertThat(message.type()).isNull();
        assertThat(MessageType.fromWireName(null)).isNull();
    }

    @Test
    void onlyNegotiationMessagesAreRelayed() {
        assertThat(MessageType.OFFER.isRelayed()).isTrue();
        assertThat(MessageType.ICE_CANDIDATE.isRelayed()).isTrue();
        assertThat(MessageType.END_CALL.isRelayed()).isFalse();
        assertThat(MessageType.ROOM_STATUS.isRelayed()).isFalse();
    }

    @Test
    void toStringHidesSessionDescription() {
        var message = SignalingMessage.offer(SessionDescription.offer("v=0\r\no=- 4611731400430051336 2 IN IP4 127.0.0.1"));

        assertThat(message.toString()).doesNotContain("127.0.0.1").contains("offer");
    }
}
