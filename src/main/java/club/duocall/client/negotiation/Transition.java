package club.duocall.client.negotiation;

import java.util.List;

/**
 * 一次状态迁移的结果: 新的会话快照以及需要执行的命令。
 */
public record Transition(NegotiationSession session, List<NegotiationCommand> commands) {

    public Transition {
        commands = List.copyOf(commands);
    }

    public static Transition unchanged(NegotiationSession session) {
        return new Transition(session, List.of());
    }

    public static Transition of(NegotiationSession session, NegotiationCommand... commands) {
        return new Transition(session, List.of(commands));
    }
}
