package com.rtbhouse.kafka.dispatch.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Map;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.config.ConfigException;
import org.junit.Test;
import org.junit.runner.RunWith;

import com.rtbhouse.kafka.dispatch.api.pool.PoolFaultAction;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;

@RunWith(JUnitParamsRunner.class)
public class DispatchConfigTest {

    @Test
    public void shouldUseDefaults() {
        DispatchConfig config = new DispatchConfig(Map.of(DispatchConfig.CONSUMER_TOPICS, "a,b"));

        assertThat(config.getTopics()).containsExactly("a", "b");
        assertThat(config.getThreadsNum("a")).isEqualTo(1);
        assertThat(config.getWorkersNum()).isEqualTo(10);
        assertThat(config.getTaskTimeout()).isEqualTo(Duration.ofMinutes(1));
        assertThat(config.getTaskRetries()).isZero();
        assertThat(config.getFailureThreshold()).isEqualTo(100);
        assertThat(config.getFailureWindow()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.getPoolFaultAction()).isEqualTo(PoolFaultAction.SHUTDOWN_CONSUMER);
        assertThat(config.getConsumerCommitInterval()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.getCommitRetries()).isEqualTo(3);
    }

    @Test
    public void shouldOverridePropertiesWithPrefixedOnes() {
        DispatchConfig config = new DispatchConfig(Map.of(
                DispatchConfig.CONSUMER_TOPICS, "a",
                DispatchConfig.POOL_WORKERS_NUM, "5",
                "kafka.dispatch." + DispatchConfig.POOL_WORKERS_NUM, "7"));

        assertThat(config.getWorkersNum()).isEqualTo(7);
    }

    @Test
    public void shouldUsePerTopicThreadsNumber() {
        DispatchConfig config = new DispatchConfig(Map.of(
                DispatchConfig.CONSUMER_TOPICS, "a,b",
                DispatchConfig.CONSUMER_THREADS_NUM, "2",
                DispatchConfig.CONSUMER_TOPIC_THREADS, "b:4"));

        assertThat(config.getThreadsNum("a")).isEqualTo(2);
        assertThat(config.getThreadsNum("b")).isEqualTo(4);
    }

    @Test
    @Parameters({ "b", "b:0", "b:x", ":3" })
    public void shouldRejectInvalidTopicThreads(String topicThreads) {
        assertThatThrownBy(() -> new DispatchConfig(Map.of(
                DispatchConfig.CONSUMER_TOPICS, "a",
                DispatchConfig.CONSUMER_TOPIC_THREADS, topicThreads)))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    @Parameters({ "shutdown_consumer, SHUTDOWN_CONSUMER", "STOP_PARTITION, STOP_PARTITION" })
    public void shouldParsePoolFaultAction(String value, PoolFaultAction expected) {
        DispatchConfig config = new DispatchConfig(Map.of(
                DispatchConfig.CONSUMER_TOPICS, "a",
                DispatchConfig.POOL_FAULT_ACTION, value));

        assertThat(config.getPoolFaultAction()).isEqualTo(expected);
    }

    @Test
    public void shouldRejectUnknownPoolFaultAction() {
        assertThatThrownBy(() -> new DispatchConfig(Map.of(
                DispatchConfig.CONSUMER_TOPICS, "a",
                DispatchConfig.POOL_FAULT_ACTION, "ignore")))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    public void shouldRejectNonPositiveFailureThreshold() {
        assertThatThrownBy(() -> new DispatchConfig(Map.of(
                DispatchConfig.CONSUMER_TOPICS, "a",
                DispatchConfig.POOL_FAILURE_THRESHOLD, "0")))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    public void shouldPassConsumerConfigsWithoutPrefixAndDisableAutoCommit() {
        DispatchConfig config = new DispatchConfig(Map.of(
                DispatchConfig.CONSUMER_TOPICS, "a",
                DispatchConfig.CONSUMER_PREFIX + ConsumerConfig.GROUP_ID_CONFIG, "group"));

        assertThat(config.getConsumerConfigs())
                .containsEntry(ConsumerConfig.GROUP_ID_CONFIG, "group")
                .containsEntry(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    }

    @Test
    public void shouldRejectEnabledAutoCommit() {
        assertThatThrownBy(() -> new DispatchConfig(Map.of(
                DispatchConfig.CONSUMER_TOPICS, "a",
                DispatchConfig.CONSUMER_PREFIX + ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true")))
                .isInstanceOf(IllegalStateException.class);
    }
}
