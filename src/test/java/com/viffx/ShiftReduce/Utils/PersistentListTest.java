package com.viffx.ShiftReduce.Utils;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class PersistentListTest {

    @Test
    public void push_leaves_the_original_untouched() {
        PersistentList<String> one = PersistentList.<String>empty().push("a");
        PersistentList<String> two = one.push("b");

        assertEquals(List.of("a"), one.toList());
        assertEquals(List.of("b", "a"), two.toList());
        assertEquals(List.of("a", "b"), two.toReversedList());
        assertSame(one, two.pop());
    }

    @Test
    public void siblings_share_their_tail() {
        PersistentList<String> base = PersistentList.<String>empty().push("x").push("y");
        PersistentList<String> left = base.push("l");
        PersistentList<String> right = base.push("r");

        assertSame(left.pop(), right.pop());
        assertEquals(3, left.size());
        assertEquals("y", right.get(1));
    }

    @Test
    public void drop_and_get_check_bounds() {
        PersistentList<Integer> list = PersistentList.<Integer>empty().push(1).push(2).push(3);

        assertEquals(List.of(1), list.drop(2).toList());
        assertTrue(list.drop(3).isEmpty());
        assertThrows(IndexOutOfBoundsException.class, () -> list.drop(4));
        assertThrows(IndexOutOfBoundsException.class, () -> list.get(3));
        assertThrows(IndexOutOfBoundsException.class, () -> list.get(-1));
    }

    @Test
    public void empty_list_rejects_pop_and_peek() {
        PersistentList<String> empty = PersistentList.empty();

        assertTrue(empty.isEmpty());
        assertThrows(NoSuchElementException.class, empty::pop);
        assertThrows(NoSuchElementException.class, empty::peek);
        assertFalse(empty.iterator().hasNext());
    }

    @Test
    public void equality_is_structural() {
        PersistentList<String> a = PersistentList.<String>empty().push("p").push("q");
        PersistentList<String> b = PersistentList.<String>empty().push("p").push("q");
        PersistentList<String> c = PersistentList.<String>empty().push("q").push("p");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
        assertEquals("[q, p]", a.toString());
    }
}
