package com.dinoroyale.matchservice.support;

import com.dinoroyale.matchservice.match.domain.port.BroadcastChannel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 记录所有广播与点对点消息，供断言使用。
 */
public class RecordingBroadcastChannel implements BroadcastChannel {

    /** playerId 为 null 表示广播 */
    public record Sent(String playerId, String event, Object payload) {
    }

    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public void publish(String eventName, Object payload) {
        if (failing) throw new IllegalStateException("broadcast down");
        sent.add(new Sent(null, eventName, payload));
    }

    @Override
    public void sendTo(String playerId, String eventName, Object payload) {
        if (failing) throw new IllegalStateException("broadcast down");
        sent.add(new Sent(playerId, eventName, payload));
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public List<Sent> all() {
        return List.copyOf(sent);
    }

    /** 某类广播事件的载荷（按发送顺序） */
    public <T> List<T> published(String event, Class<T> type) {
        return sent.stream()
                .filter(s -> s.playerId() == null && s.event().equals(event))
                .map(s -> type.cast(s.payload()))
                .toList();
    }

    /** 发给某玩家的某类事件载荷 */
    public <T> List<T> sentTo(String playerId, String event, Class<T> type) {
        return sent.stream()
                .filter(s -> playerId.equals(s.playerId()) && s.event().equals(event))
                .map(s -> type.cast(s.payload()))
                .toList();
    }

    public <T> T lastPublished(String event, Class<T> type) {
        List<T> list = published(event, type);
        return list.isEmpty() ? null : list.get(list.size() - 1);
    }

    public void clear() {
        sent.clear();
    }
}
