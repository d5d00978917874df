package com.kb.metering.service;

import com.kb.metering.billing.SettlementPolicy;
import com.kb.metering.config.MeteringProperties;
import com.kb.metering.config.MeteringProperties.GiftDefinition;
import com.kb.metering.exception.UnauthorizedParticipantException;
import com.kb.metering.hub.ConnectionHub;
import com.kb.metering.hub.HubConnection;
import com.kb.metering.ledger.LedgerChange;
import com.kb.metering.ledger.LedgerConflictRetry;
import com.kb.metering.ledger.LedgerStore;
import com.kb.metering.model.entity.ClientBalance;
import com.kb.metering.model.entity.GiftTransaction;
import com.kb.metering.model.entity.Livestream;
import com.kb.metering.model.entity.ReaderBalance;
import com.kb.metering.model.entity.SettlementRecord;
import com.kb.metering.model.event.GiftSentEvent;
import com.kb.metering.model.message.inbound.SendGiftMessage;
import com.kb.metering.model.message.outbound.BalanceUpdatedMessage;
import com.kb.metering.model.message.outbound.ChatBroadcastMessage;
import com.kb.metering.model.message.outbound.GiftAnimationMessage;
import com.kb.metering.model.message.outbound.GiftConfirmedMessage;
import com.kb.metering.util.ServerInstanceIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * 방송 선물 서비스
 * 카탈로그 검증 후 세션과 같은 정산 경로로 수신자에게 적립하고, 채팅과 애니메이션 이벤트로 전파
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GiftService {

    private final LedgerStore ledgerStore;
    private final SettlementPolicy settlementPolicy;
    private final GiftCatalog giftCatalog;
    private final ConnectionHub hub;
    private final ChatFanoutService chatFanoutService;
    private final KafkaEventPublisher eventPublisher;
    private final ServerInstanceIdGenerator serverInstanceIdGenerator;
    private final Clock meteringClock;
    private final MeteringProperties properties;

    /**
     * 선물 보내기
     *
     * @return 저장된 선물 거래
     */
    public Mono<GiftTransaction> send(HubConnection sender, SendGiftMessage message) {
        if (!sender.isAuthenticated()) {
            return Mono.error(new UnauthorizedParticipantException("로그인한 사용자만 선물할 수 있습니다"));
        }
        String roomId = ConnectionHub.broadcastRoomId(message.getBroadcastId());
        if (!hub.isMember(sender.getId(), roomId)) {
            return Mono.error(new UnauthorizedParticipantException("시청 중인 방송에만 선물할 수 있습니다"));
        }
        GiftDefinition gift = giftCatalog.find(message.getGiftId()).orElse(null);
        if (gift == null) {
            return Mono.error(new IllegalArgumentException("알 수 없는 선물입니다: " + message.getGiftId()));
        }
        String senderId = sender.getUserId();
        String transactionId = UUID.randomUUID().toString();

        return Mono.defer(() -> ledgerStore.findLivestream(message.getBroadcastId())
                        .switchIfEmpty(Mono.error(() -> new IllegalArgumentException(
                                "방송을 찾을 수 없습니다: " + message.getBroadcastId())))
                        .flatMap(livestream -> {
                            if (senderId.equals(livestream.getHostId())) {
                                return Mono.error(new IllegalArgumentException("자신의 방송에는 선물할 수 없습니다"));
                            }
                            return Mono.zip(ledgerStore.loadClientBalance(senderId),
                                            ledgerStore.loadReaderBalance(livestream.getHostId()))
                                    .flatMap(balances -> settle(transactionId, message.getGiftId(), gift, livestream,
                                            balances.getT1(), balances.getT2()));
                        }))
                .retryWhen(LedgerConflictRetry.conflicts(properties.getBilling().getMaxConflictRetries()))
                .doOnError(error -> log.warn("선물 처리 실패: broadcastId={}, senderId={}, giftId={}, error={}",
                        message.getBroadcastId(), senderId, message.getGiftId(), error.getMessage()))
                .flatMap(result -> {
                    GiftTransaction transaction = result.getT1();
                    announce(sender, transaction, gift, result.getT2());
                    return eventPublisher.publishQuietly(GiftSentEvent.builder()
                                    .roomId(roomId)
                                    .originServerId(serverInstanceIdGenerator.getServerInstanceId())
                                    .broadcastId(message.getBroadcastId())
                                    .transactionId(transaction.getId())
                                    .senderId(senderId)
                                    .receiverId(transaction.getReceiverId())
                                    .giftId(transaction.getGiftId())
                                    .label(gift.getLabel())
                                    .amount(transaction.getAmount())
                                    .animation(gift.getAnimation())
                                    .build())
                            .thenReturn(transaction);
                });
    }

    private Mono<Tuple2<GiftTransaction, ClientBalance>> settle(String transactionId, String giftId, GiftDefinition gift,
                                                               Livestream livestream, ClientBalance senderBalance,
                                                               ReaderBalance receiverBalance) {
        Instant now = meteringClock.instant();
        GiftTransaction transaction = GiftTransaction.builder()
                .id(transactionId)
                .livestreamId(livestream.getId())
                .senderId(senderBalance.getClientId())
                .receiverId(livestream.getHostId())
                .giftId(giftId)
                .label(gift.getLabel())
                .amount(gift.getPrice())
                .createdAt(now)
                .build();
        SettlementRecord settlement = settlementPolicy.settleGift(transaction, senderBalance, receiverBalance, now);
        livestream.setEarnings(livestream.getEarnings() + transaction.getAmount());

        return ledgerStore.commit(LedgerChange.builder()
                        .giftTransaction(transaction)
                        .clientBalance(senderBalance)
                        .readerBalance(receiverBalance)
                        .settlement(settlement)
                        .livestream(livestream)
                        .build())
                .doOnSuccess(ignored -> log.info("선물 정산: transactionId={}, livestreamId={}, senderId={}, receiverId={}, amount={}, readerShare={}",
                        transactionId, livestream.getId(), transaction.getSenderId(), transaction.getReceiverId(),
                        transaction.getAmount(), settlement.getReaderShare()))
                .thenReturn(Tuples.of(transaction, senderBalance));
    }

    private void announce(HubConnection sender, GiftTransaction transaction, GiftDefinition gift, ClientBalance balance) {
        String broadcastId = transaction.getLivestreamId();
        String roomId = ConnectionHub.broadcastRoomId(broadcastId);

        chatFanoutService.publish(ChatBroadcastMessage.builder()
                .roomId(roomId)
                .messageId(transaction.getId())
                .senderId(transaction.getSenderId())
                .content(gift.getLabel())
                .timestamp(transaction.getCreatedAt())
                .gift(true)
                .giftId(transaction.getGiftId())
                .giftValue(transaction.getAmount())
                .build());
        hub.broadcast(roomId, GiftAnimationMessage.builder()
                .broadcastId(broadcastId)
                .senderId(transaction.getSenderId())
                .giftId(transaction.getGiftId())
                .label(gift.getLabel())
                .value(transaction.getAmount())
                .animation(gift.getAnimation())
                .build(), null);

        hub.sendToConnection(sender.getId(), GiftConfirmedMessage.builder()
                .transactionId(transaction.getId())
                .giftId(transaction.getGiftId())
                .amount(transaction.getAmount())
                .available(balance.getAvailable())
                .build());
        hub.sendToUser(transaction.getSenderId(), BalanceUpdatedMessage.builder()
                .available(balance.getAvailable())
                .locked(balance.getLocked())
                .build());
    }
}
