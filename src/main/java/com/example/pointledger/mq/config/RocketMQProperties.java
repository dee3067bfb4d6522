package com.example.pointledger.mq.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * RocketMQ 配置屬性
 *
 * 集中管理從 application.yaml 讀取的 RocketMQ 配置（僅 Producer，本服務不消費訊息）
 */
@Data
@Component
@ConfigurationProperties(prefix = "rocketmq")
public class RocketMQProperties {

    /**
     * NameServer 地址
     */
    private String nameServer;

    /**
     * Producer 配置
     */
    private Producer producer = new Producer();

    @Data
    public static class Producer {
        private String group;
        private int sendMessageTimeout = 3000;
        private int retryTimesWhenSendFailed = 2;
    }
}
