package com.example.pointledger.mq.producer;

import com.example.pointledger.event.PointBalanceChangedEvent;
import com.example.pointledger.event.TransferRequestStatusChangedEvent;
import com.example.pointledger.mq.msg.PointBalanceChangedMsg;
import com.example.pointledger.mq.msg.TransferRequestStatusMsg;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.rocketmq.client.producer.DefaultMQProducer;
import org.apache.rocketmq.client.producer.SendResult;
import org.apache.rocketmq.common.message.Message;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

import static com.example.pointledger.mq.constants.MQConstants.*;

/**
 * 帳本事件 Producer
 *
 * 職責：
 * 1. 發送點數餘額變動通知
 * 2. 發送轉帳請求狀態變更通知
 *
 * 錯誤處理：
 * - 使用同步發送
 * - 發送失敗時拋出 LedgerEventPublishException，由事件監聽器記錄（帳本事務已提交，不回滾）
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LedgerEventProducer {

    private final DefaultMQProducer producer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * 發送點數餘額變動通知
     *
     * @param event 餘額變動事件
     */
    public void sendBalanceChanged(PointBalanceChangedEvent event) {
        PointBalanceChangedMsg msg = PointBalanceChangedMsg.builder()
                .userId(event.getUserId())
                .type(event.getChangeType())
                .amount(event.getAmount())
                .batchId(event.getBatchId())
                .reference(event.getReference())
                .timestamp(clock.millis())
                .build();

        sendMsg(msg, TAG_BALANCE_CHANGED, event.getUserId());
        log.info("Sent balance changed: userId={}, type={}, amount={}",
                event.getUserId(), event.getChangeType(), event.getAmount());
    }

    /**
     * 發送轉帳請求狀態變更通知
     *
     * 以收款方作為 sharding key，同一收款方的通知依序送達
     *
     * @param event 狀態變更事件
     */
    public void sendTransferRequestStatus(TransferRequestStatusChangedEvent event) {
        TransferRequestStatusMsg msg = TransferRequestStatusMsg.builder()
                .transferRequestId(event.getTransferRequestId())
                .fromUserId(event.getFromUserId())
                .toUserId(event.getToUserId())
                .amount(event.getAmount())
                .oldStatus(event.getOldStatus())
                .newStatus(event.getNewStatus())
                .timestamp(clock.millis())
                .build();

        sendMsg(msg, TAG_TRANSFER_REQUEST_STATUS, event.getToUserId());
        log.info("Sent transfer request status: id={}, {} -> {}",
                event.getTransferRequestId(), event.getOldStatus(), event.getNewStatus());
    }

    /**
     * 發送訊息到 RocketMQ
     *
     * @param payload 訊息內容
     * @param tag     Tag
     * @param userId  用戶 ID（用於 sharding）
     */
    private void sendMsg(Object payload, String tag, String userId) {
        try {
            String json = objectMapper.writeValueAsString(payload);
            Message message = new Message(TOPIC_POINT_LEDGER_EVENTS, tag, userId, json.getBytes(StandardCharsets.UTF_8));
            message.putUserProperty("__SHARDINGKEY", userId);
            SendResult result = producer.send(message, (mqs, msg, arg) -> {
                String id = (String) arg;
                int index = Math.floorMod(id.hashCode(), mqs.size());
                return mqs.get(index);
            }, userId);

            log.debug("Sent MQ message: tag={}, userId={}, msgId={}", tag, userId, result.getMsgId());
        } catch (Exception e) {
            log.error("Failed to send MQ message: tag={}, userId={}", tag, userId, e);
            throw new LedgerEventPublishException("Failed to send MQ message", e);
        }
    }
}
