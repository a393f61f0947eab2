package qctl.queue;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class IndexedPriorityQueueTest {

    @Test
    public void minQueueExtractsAscending() {
        IndexedPriorityQueue q = IndexedPriorityQueue.minQueue(5);
        q.insert(0, 0.5);
        q.insert(1, -1.0);
        q.insert(2, 1.0);
        q.insert(3, 0.0);
        assertEquals(4, q.size());
        assertEquals(1, q.peek());
        assertEquals(Arrays.asList(1, 3, 0, 2), drain(q));
        assertTrue(q.isEmpty());
    }

    @Test
    public void maxQueueExtractsDescending() {
        IndexedPriorityQueue q = IndexedPriorityQueue.maxQueue(4);
        q.insert(0, 0.5);
        q.insert(1, -1.0);
        q.insert(2, 1.0);
        q.insert(3, 0.0);
        List<Integer> order = new ArrayList<>();
        while (!q.isEmpty()) order.add(q.extractMax());
        assertEquals(Arrays.asList(2, 0, 3, 1), order);
    }

    @Test
    public void equalKeysLeaveInInsertionOrder() {
        IndexedPriorityQueue q = IndexedPriorityQueue.minQueue(6);
        int[] insertion = {4, 1, 5, 0, 3, 2};
        for (int e : insertion) q.insert(e, 0.25);
        assertEquals(Arrays.asList(4, 1, 5, 0, 3, 2), drain(q));
    }

    @Test
    public void keyUpdateKeepsOriginalRank() {
        IndexedPriorityQueue q = IndexedPriorityQueue.maxQueue(3);
        q.insert(0, 0.5);
        q.insert(1, -1.0);
        q.insert(2, 0.5);
        q.increaseKey(1, 0.5);
        List<Integer> order = new ArrayList<>();
        while (!q.isEmpty()) order.add(q.extractMax());
        assertEquals(Arrays.asList(0, 1, 2), order);
    }

    @Test
    public void decreaseKeyMovesElementForward() {
        IndexedPriorityQueue q = IndexedPriorityQueue.minQueue(3);
        q.insert(0, 0.0);
        q.insert(1, 1.0);
        q.insert(2, 0.5);
        q.decreaseKey(1, -0.5);
        assertEquals(-0.5, q.priorityOf(1), 0.0);
        assertEquals(Arrays.asList(1, 0, 2), drain(q));
    }

    @Test
    public void offerInsertsOrImproves() {
        IndexedPriorityQueue q = IndexedPriorityQueue.minQueue(2);
        assertTrue(q.offer(0, 0.5));
        assertFalse(q.offer(0, 0.75));
        assertTrue(q.offer(0, 0.25));
        assertEquals(0.25, q.priorityOf(0), 0.0);
        assertFalse(q.contains(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void decreaseKeyRejectsLargerKey() {
        IndexedPriorityQueue q = IndexedPriorityQueue.minQueue(1);
        q.insert(0, 0.0);
        q.decreaseKey(0, 0.5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void increaseKeyRejectsSmallerKey() {
        IndexedPriorityQueue q = IndexedPriorityQueue.maxQueue(1);
        q.insert(0, 0.0);
        q.increaseKey(0, -0.5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateInsertIsRejected() {
        IndexedPriorityQueue q = IndexedPriorityQueue.minQueue(1);
        q.insert(0, 0.0);
        q.insert(0, 1.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void nanKeyIsRejected() {
        IndexedPriorityQueue.minQueue(1).insert(0, Double.NaN);
    }

    @Test(expected = IllegalStateException.class)
    public void extractFromEmptyQueue() {
        IndexedPriorityQueue.minQueue(1).extract();
    }

    @Test(expected = IllegalStateException.class)
    public void extractMaxOnMinQueue() {
        IndexedPriorityQueue q = IndexedPriorityQueue.minQueue(1);
        q.insert(0, 0.0);
        q.extractMax();
    }

    @Test
    public void extractedElementCanBeInsertedAgain() {
        IndexedPriorityQueue q = IndexedPriorityQueue.minQueue(2);
        q.insert(0, 0.0);
        assertEquals(0, q.extract());
        assertFalse(q.contains(0));
        q.insert(0, 1.0);
        assertTrue(q.contains(0));
    }

    @Test
    public void randomUpdatesStayOrdered() {
        Random random = new Random(7);
        int n = 200;
        IndexedPriorityQueue q = IndexedPriorityQueue.minQueue(n);
        for (int i = 0; i < n; i++) q.insert(i, random.nextDouble());
        for (int k = 0; k < 500; k++) {
            int e = random.nextInt(n);
            q.decreaseKey(e, q.priorityOf(e) * random.nextDouble());
        }
        double last = Double.NEGATIVE_INFINITY;
        int count = 0;
        while (!q.isEmpty()) {
            int e = q.peek();
            double p = q.priorityOf(e);
            assertEquals(e, q.extractMin());
            assertTrue(p >= last);
            last = p;
            count++;
        }
        assertEquals(n, count);
    }

    private static List<Integer> drain(IndexedPriorityQueue q) {
        List<Integer> order = new ArrayList<>();
        while (!q.isEmpty()) order.add(q.extract());
        return order;
    }
}
