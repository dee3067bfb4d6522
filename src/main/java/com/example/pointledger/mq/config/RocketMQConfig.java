package com.example.pointledger.mq.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.rocketmq.client.exception.MQClientException;
import org.apache.rocketmq.client.producer.DefaultMQProducer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RocketMQ 配置類
 *
 * 配置帳本事件 Producer 和 JSON 序列化器
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class RocketMQConfig {

    private final RocketMQProperties properties;

    /**
     * 配置 RocketMQ Producer
     *
     * @return DefaultMQProducer 實例
     * @throws MQClientException 如果初始化失敗
     */
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public DefaultMQProducer producer() throws MQClientException {
        DefaultMQProducer producer = new DefaultMQProducer(properties.getProducer().getGroup());
        producer.setNamesrvAddr(properties.getNameServer());
        producer.setSendMsgTimeout(properties.getProducer().getSendMessageTimeout());
        producer.setRetryTimesWhenSendFailed(properties.getProducer().getRetryTimesWhenSendFailed());
        log.info("RocketMQ producer initialized: nameServer={}, group={}",
                properties.getNameServer(), properties.getProducer().getGroup());
        return producer;
    }

    /**
     * ObjectMapper：訊息與 REST 回應共用，時間以 ISO-8601 字串輸出
     * 點數為整數，小數輸入直接拒絕而不截斷
     */
    @Bean
    public ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }
}
