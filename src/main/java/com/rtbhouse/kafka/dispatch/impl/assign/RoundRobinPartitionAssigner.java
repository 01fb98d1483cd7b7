package com.rtbhouse.kafka.dispatch.impl.assign;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.kafka.common.TopicPartition;

public class RoundRobinPartitionAssigner implements PartitionAssigner {

    private static final Comparator<TopicPartition> COMPARATOR = Comparator.comparing(TopicPartition::topic)
            .thenComparingInt(TopicPartition::partition);

    @Override
    public List<List<TopicPartition>> assign(Collection<TopicPartition> partitions, int threads) {
        checkArgument(threads > 0, "threads number should be positive but is: %s", threads);
        final List<TopicPartition> sortedPartitions = partitions.stream()
                .distinct()
                .sorted(COMPARATOR)
                .collect(Collectors.toList());
        final List<List<TopicPartition>> slots = new ArrayList<>(threads);
        for (int i = 0; i < threads; i++) {
            slots.add(new ArrayList<>());
        }
        int index = 0;
        for (TopicPartition partition : sortedPartitions) {
            slots.get(index).add(partition);
            index = (index + 1) % threads;
        }
        return slots.stream().map(List::copyOf).collect(Collectors.toList());
    }
}
