package com.rtbhouse.kafka.dispatch.impl.consumer;

import java.util.Collection;

import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.common.TopicPartition;

import com.rtbhouse.kafka.dispatch.api.DispatchException;
import com.rtbhouse.kafka.dispatch.impl.Partitioned;

public class ConsumerRebalanceListenerImpl implements ConsumerRebalanceListener {

    private final Partitioned partitioned;
    private RuntimeException exception;

    public ConsumerRebalanceListenerImpl(Partitioned partitioned) {
        this.partitioned = partitioned;
    }

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
        try {
            partitioned.unregister(partitions);
        } catch (InterruptedException e) {
            exception = new DispatchException("InterruptedException", e);
            throw exception;
        } catch (RuntimeException e) {
            exception = e;
            throw exception;
        }
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
        try {
            partitioned.register(partitions);
        } catch (InterruptedException e) {
            exception = new DispatchException("InterruptedException", e);
            throw exception;
        } catch (RuntimeException e) {
            exception = e;
            throw exception;
        }
    }

    public void rethrowExceptionCaughtDuringRebalance() {
        // exceptions thrown by a rebalance listener are only logged by some KafkaConsumer versions
        if (exception != null) {
            throw (exception instanceof DispatchException) ? (DispatchException) exception : new DispatchException(exception);
        }
    }
}
