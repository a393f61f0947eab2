package qctl.queue;

import java.util.Arrays;

/**
 * Binary heap over the integers 0..capacity-1 with a position index, so that a
 * key can be changed in O(log n) without searching for the element.
 *
 * <p>The order is fixed at construction: {@link Order#ASCENDING} extracts the
 * smallest priority first, {@link Order#DESCENDING} the largest. Equal
 * priorities are extracted in the order the elements were first inserted;
 * changing a key keeps the element's original insertion rank.
 *
 * <p>Not thread safe. One instance belongs to one fixpoint computation.
 */
public class IndexedPriorityQueue {

    public enum Order { ASCENDING, DESCENDING }

    private final Order order;
    private final int[] heap;       // heap slot -> element
    private final int[] position;   // element -> heap slot, -1 when absent
    private final double[] priority;
    private final long[] sequence;
    private int size;
    private long nextSequence;

    public IndexedPriorityQueue(int capacity, Order order) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative: " + capacity);
        }
        this.order = order;
        this.heap = new int[capacity];
        this.position = new int[capacity];
        this.priority = new double[capacity];
        this.sequence = new long[capacity];
        Arrays.fill(position, -1);
    }

    public static IndexedPriorityQueue minQueue(int capacity) {
        return new IndexedPriorityQueue(capacity, Order.ASCENDING);
    }

    public static IndexedPriorityQueue maxQueue(int capacity) {
        return new IndexedPriorityQueue(capacity, Order.DESCENDING);
    }

    public Order getOrder() {
        return order;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean contains(int element) {
        checkElement(element);
        return position[element] >= 0;
    }

    public double priorityOf(int element) {
        if (!contains(element)) {
            throw new IllegalArgumentException("Element " + element + " is not queued");
        }
        return priority[element];
    }

    public void insert(int element, double key) {
        checkKey(key);
        if (contains(element)) {
            throw new IllegalArgumentException("Element " + element + " is already queued");
        }
        int slot = size++;
        heap[slot] = element;
        position[element] = slot;
        priority[element] = key;
        sequence[element] = nextSequence++;
        siftUp(slot);
    }

    public void decreaseKey(int element, double key) {
        checkKey(key);
        double current = priorityOf(element);
        if (key > current) {
            throw new IllegalArgumentException("New key " + key + " is larger than current key " + current);
        }
        changeKey(element, key);
    }

    public void increaseKey(int element, double key) {
        checkKey(key);
        double current = priorityOf(element);
        if (key < current) {
            throw new IllegalArgumentException("New key " + key + " is smaller than current key " + current);
        }
        changeKey(element, key);
    }

    /**
     * Inserts the element, or moves its key towards the front of the queue if the
     * new key is better. A worse key is ignored.
     *
     * @return true if the queue changed
     */
    public boolean offer(int element, double key) {
        if (!contains(element)) {
            insert(element, key);
            return true;
        }
        if (before(key, priority[element])) {
            changeKey(element, key);
            return true;
        }
        return false;
    }

    /** Element at the front of the queue, without removing it. */
    public int peek() {
        if (size == 0) {
            throw new IllegalStateException("Queue is empty");
        }
        return heap[0];
    }

    public int extractMin() {
        if (order != Order.ASCENDING) {
            throw new IllegalStateException("extractMin on a descending queue");
        }
        return extract();
    }

    public int extractMax() {
        if (order != Order.DESCENDING) {
            throw new IllegalStateException("extractMax on an ascending queue");
        }
        return extract();
    }

    /** Removes and returns the element at the front according to the queue's order. */
    public int extract() {
        if (size == 0) {
            throw new IllegalStateException("Queue is empty");
        }
        int top = heap[0];
        size--;
        if (size > 0) {
            move(heap[size], 0);
            siftDown(0);
        }
        position[top] = -1;
        return top;
    }

    private void changeKey(int element, double key) {
        double old = priority[element];
        priority[element] = key;
        int slot = position[element];
        if (before(key, old)) siftUp(slot);
        else siftDown(slot);
    }

    private void siftUp(int slot) {
        int element = heap[slot];
        while (slot > 0) {
            int parent = (slot - 1) >>> 1;
            if (!precedes(element, heap[parent])) break;
            move(heap[parent], slot);
            slot = parent;
        }
        move(element, slot);
    }

    private void siftDown(int slot) {
        int element = heap[slot];
        int half = size >>> 1;
        while (slot < half) {
            int child = 2 * slot + 1;
            int right = child + 1;
            if (right < size && precedes(heap[right], heap[child])) child = right;
            if (!precedes(heap[child], element)) break;
            move(heap[child], slot);
            slot = child;
        }
        move(element, slot);
    }

    private void move(int element, int slot) {
        heap[slot] = element;
        position[element] = slot;
    }

    /** Strict queue order between two queued elements, FIFO on equal keys. */
    private boolean precedes(int a, int b) {
        double pa = priority[a];
        double pb = priority[b];
        if (pa != pb) return before(pa, pb);
        return sequence[a] < sequence[b];
    }

    private boolean before(double a, double b) {
        return order == Order.ASCENDING ? a < b : a > b;
    }

    private void checkElement(int element) {
        if (element < 0 || element >= position.length) {
            throw new IllegalArgumentException("Element " + element + " outside [0, " + position.length + ")");
        }
    }

    private static void checkKey(double key) {
        if (Double.isNaN(key)) {
            throw new IllegalArgumentException("Priority must not be NaN");
        }
    }
}
