package com.challenges.collector.query;

/**
 * Slots for the tuple being assembled while one record is walked. Belongs to a
 * single collect call and is never shared.
 */
public final class ScratchBuffer {
    private final Object[] elements;
    private final Object[] groups;

    public ScratchBuffer(CompiledPlan plan) {
        this.elements = new Object[plan.elementCount()];
        this.groups = new Object[plan.groupCount()];
    }

    void setElement(int position, Object value) {
        elements[position - 1] = value;
    }

    void setGroup(int position, Object key) {
        groups[position - 1] = key;
    }

    /**
     * @return a fresh copy of the element values, in position order
     */
    public Object[] elements() {
        return elements.clone();
    }

    public Object group(int position) {
        return groups[position - 1];
    }

    public int groupCount() {
        return groups.length;
    }
}
