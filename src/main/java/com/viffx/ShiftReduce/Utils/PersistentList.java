package com.viffx.ShiftReduce.Utils;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * An immutable singly linked list that shares its tail between versions.
 * <p>
 * {@link #push(Object)} and {@link #pop()} run in constant time and never touch the receiver,
 * which makes the list suitable for stacks and append-only logs that fork at every step of a
 * search. Iteration starts at the head, i.e. the most recently pushed element.
 *
 * @param <E> element type
 */
public final class PersistentList<E> implements Iterable<E> {
    private static final PersistentList<?> EMPTY = new PersistentList<>(null, null, 0);

    private final E head;
    private final PersistentList<E> tail;
    private final int size;

    private PersistentList(E head, PersistentList<E> tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    @SuppressWarnings("unchecked")
    public static <E> PersistentList<E> empty() {
        return (PersistentList<E>) EMPTY;
    }

    // ====== PUBLIC API METHODS ====== //
    @NotNull
    @Contract("_ -> new")
    public PersistentList<E> push(@NotNull E element) {
        Objects.requireNonNull(element, "element cannot be null");
        return new PersistentList<>(element, this, size + 1);
    }

    /**
     * Returns the list without its head.
     *
     * @throws NoSuchElementException if the list is empty
     */
    @NotNull
    public PersistentList<E> pop() {
        if (isEmpty()) throw new NoSuchElementException("pop on an empty list");
        return tail;
    }

    /**
     * Returns the list without its first {@code count} elements.
     *
     * @throws IndexOutOfBoundsException if {@code count} is negative or larger than the size
     */
    @NotNull
    public PersistentList<E> drop(int count) {
        if (count < 0 || count > size) {
            throw new IndexOutOfBoundsException("Index: " + count + ", Size: " + size);
        }
        PersistentList<E> current = this;
        for (int i = 0; i < count; i++) {
            current = current.tail;
        }
        return current;
    }

    /**
     * Returns the head of the list.
     *
     * @throws NoSuchElementException if the list is empty
     */
    public E peek() {
        if (isEmpty()) throw new NoSuchElementException("peek on an empty list");
        return head;
    }

    /**
     * Returns the element {@code index} steps below the head.
     *
     * @throws IndexOutOfBoundsException if {@code index} is outside the list
     */
    public E get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + size);
        }
        return drop(index).head;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Copies the elements head first.
     */
    @NotNull
    public List<E> toList() {
        List<E> list = new ArrayList<>(size);
        for (E e : this) list.add(e);
        return list;
    }

    /**
     * Copies the elements in push order, oldest first.
     */
    @NotNull
    public List<E> toReversedList() {
        List<E> list = toList();
        Collections.reverse(list);
        return list;
    }

    @NotNull
    @Override
    public Iterator<E> iterator() {
        return new Iterator<>() {
            private PersistentList<E> current = PersistentList.this;

            @Override
            public boolean hasNext() {
                return !current.isEmpty();
            }

            @Override
            public E next() {
                if (current.isEmpty()) throw new NoSuchElementException();
                E e = current.head;
                current = current.tail;
                return e;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistentList<?> that)) return false;
        if (size != that.size) return false;
        Iterator<?> other = that.iterator();
        for (E e : this) {
            if (!Objects.equals(e, other.next())) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (E e : this) hash = 31 * hash + Objects.hashCode(e);
        return hash;
    }

    @Override
    public String toString() {
        return toList().toString();
    }
}
