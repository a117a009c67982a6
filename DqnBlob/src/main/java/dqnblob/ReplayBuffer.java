package dqnblob;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

// Bounded FIFO over a ring array
public class ReplayBuffer {
    private final Experience[] memory;
    private final int capacity;
    private final Random random;
    private int head; // index of the oldest entry
    private int size;

    public ReplayBuffer(int capacity, long seed) {
        this(capacity, new Random(seed));
    }

    public ReplayBuffer(int capacity, Random random) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.memory = new Experience[capacity];
        this.random = random;
    }

    public void add(Experience experience) {
        if (size == capacity) {
            memory[head] = experience; // overwrite oldest
            head = (head + 1) % capacity;
        } else {
            memory[(head + size) % capacity] = experience;
            size++;
        }
    }

    /**
     * Draws {@code batchSize} distinct transitions uniformly at random.
     *
     * @throws IllegalStateException if fewer than {@code batchSize} transitions are stored
     */
    public ExperienceBatch sample(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        if (size < batchSize) {
            throw new IllegalStateException("Not enough samples: " + size + " stored, " + batchSize + " requested");
        }
        // Partial Fisher-Yates over the stored positions; only swapped slots are kept
        Map<Integer, Integer> swapped = new HashMap<>();
        List<Experience> picked = new ArrayList<>(batchSize);
        for (int i = 0; i < batchSize; i++) {
            int j = i + random.nextInt(size - i);
            int chosen = swapped.getOrDefault(j, j);
            swapped.put(j, swapped.getOrDefault(i, i));
            picked.add(get(chosen));
        }
        return new ExperienceBatch(picked);
    }

    // Oldest first
    public List<Experience> contents() {
        List<Experience> list = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            list.add(get(i));
        }
        return list;
    }

    private Experience get(int offset) {
        return memory[(head + offset) % capacity];
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return capacity;
    }
}
