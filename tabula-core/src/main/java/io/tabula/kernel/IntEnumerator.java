package io.tabula.kernel;

/**
 * Primitive iterator over positions.
 */
public interface IntEnumerator {
    boolean hasNext();

    int nextInt();
}
