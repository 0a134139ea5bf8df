package com.dinoroyale.matchservice.match.infrastructure.broadcast;

import com.dinoroyale.matchservice.match.config.MatchProperties;
import com.dinoroyale.matchservice.match.domain.port.BroadcastChannel;
import com.dinoroyale.matchservice.match.interfaces.ws.dto.MatchMessages.BroadcastEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于 STOMP 的广播通道。
 * - 广播：/topic/match.{matchId}
 * - 点对点：/user/{playerId}/queue/match
 * 不保留历史，晚到的订阅者通过 /app/match.sync 或 REST 拉取快照。
 */
@Slf4j
@Component
public class StompBroadcastChannel implements BroadcastChannel {

    static final String USER_QUEUE = "/queue/match";

    private final SimpMessagingTemplate messaging;
    private final Clock clock;
    private final String matchId;
    // 单调递增序号，客户端据此丢弃乱序消息
    private final AtomicLong seq = new AtomicLong();

    public StompBroadcastChannel(SimpMessagingTemplate messaging, Clock matchClock, MatchProperties props) {
        this.messaging = messaging;
        this.clock = matchClock;
        this.matchId = props.getId();
    }

    @Override
    public void publish(String eventName, Object payload) {
        messaging.convertAndSend(topic(matchId), event(eventName, payload));
        log.debug("广播: type={}, matchId={}", eventName, matchId);
    }

    @Override
    public void sendTo(String playerId, String eventName, Object payload) {
        messaging.convertAndSendToUser(playerId, USER_QUEUE, event(eventName, payload));
        log.debug("点对点: type={}, playerId={}", eventName, playerId);
    }

    public static String topic(String matchId) {
        return "/topic/match." + matchId;
    }

    private BroadcastEvent event(String type, Object payload) {
        BroadcastEvent evt = new BroadcastEvent();
        evt.setMatchId(matchId);
        evt.setType(type);
        evt.setSeq(seq.incrementAndGet());
        evt.setTs(clock.millis());
        evt.setPayload(payload);
        return evt;
    }
}
