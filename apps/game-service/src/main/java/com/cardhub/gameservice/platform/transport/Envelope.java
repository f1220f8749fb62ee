package com.cardhub.gameservice.platform.transport;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * 传输消息外壳（平台通用）
 * - 强类型泛型载荷：Envelope<T>
 * - 最少字段：kind / game / roomId / payload / ts / seq
 * - ts 取自权威时钟；seq 对 STATE 为状态版本号，对计时事件为计时器序号
 *
 * 用法示例：
 *   Envelope<BigTwoSnapshot> msg = Envelope.state("bigtwo", roomId, snapshot, snapshot.version(), clock.millis());
 *   Envelope<ErrorPayload>   err = Envelope.error("bigtwo", roomId, payload, clock.millis());
 */
public final class Envelope<T> implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    /** 消息类别（语义层）：STATE=完整状态，EVENT=增量事件，ERROR=错误通知 */
    public enum Kind { STATE, EVENT, ERROR }

    private final Kind kind;
    private final String game;
    private final String roomId;
    private final T payload;
    private final long ts;         // 服务器时间戳（ms）
    private final long seq;        // 房间内递增序号，没有就传 0

    private Envelope(Kind kind, String game, String roomId, T payload, long ts, long seq) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.game = Objects.requireNonNull(game, "game");
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.payload = payload;
        this.ts = ts;
        this.seq = seq;
    }

    public static <T> Envelope<T> of(Kind kind, String game, String roomId, T payload, long seq, long ts) {
        return new Envelope<>(kind, game, roomId, payload, ts, seq);
    }

    /** 完整状态广播 */
    public static <T> Envelope<T> state(String game, String roomId, T payload, long seq, long ts) {
        return of(Kind.STATE, game, roomId, payload, seq, ts);
    }

    /** 增量事件（如计时 TICK、自动过牌） */
    public static <T> Envelope<T> event(String game, String roomId, T payload, long seq, long ts) {
        return of(Kind.EVENT, game, roomId, payload, seq, ts);
    }

    /** 错误通知 */
    public static <T> Envelope<T> error(String game, String roomId, T payload, long ts) {
        return of(Kind.ERROR, game, roomId, payload, 0, ts);
    }

    // Getters（不可变对象，无 setters）
    public Kind getKind()   { return kind; }
    public String getGame() { return game; }
    public String getRoomId() { return roomId; }
    public T getPayload()   { return payload; }
    public long getTs()     { return ts; }
    public long getSeq()    { return seq; }

    @Override public String toString() {
        return "Envelope{" +
                "kind=" + kind +
                ", game='" + game + '\'' +
                ", roomId='" + roomId + '\'' +
                ", ts=" + ts +
                ", seq=" + seq +
                '}';
    }
}
