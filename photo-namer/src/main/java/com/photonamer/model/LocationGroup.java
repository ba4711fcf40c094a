package com.photonamer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Photos taken at the same spot. Membership is decided against the reference
 * point, the coordinate of the first record assigned to the group.
 */
public class LocationGroup {
    private final int groupId;
    private final PhotoRecord referenceRecord;
    private final List<PhotoRecord> members = new ArrayList<>();
    private List<PhotoRecord> orderedMembers = List.of();

    public LocationGroup(int groupId, PhotoRecord referenceRecord) {
        this.groupId = groupId;
        this.referenceRecord = referenceRecord;
        this.members.add(referenceRecord);
    }

    public int getGroupId() {
        return groupId;
    }

    public int getSequence() {
        return groupId + 1;
    }

    public double getReferenceLatitude() {
        return referenceRecord.getLatitude();
    }

    public double getReferenceLongitude() {
        return referenceRecord.getLongitude();
    }

    public PhotoRecord getReferenceRecord() {
        return referenceRecord;
    }

    public void addMember(PhotoRecord record) {
        members.add(record);
    }

    /**
     * Members in the order they were assigned.
     */
    public List<PhotoRecord> getMembers() {
        return Collections.unmodifiableList(members);
    }

    /**
     * Members in duplicate-index order.
     */
    public List<PhotoRecord> getOrderedMembers() {
        return orderedMembers;
    }

    public void setOrderedMembers(List<PhotoRecord> orderedMembers) {
        this.orderedMembers = List.copyOf(orderedMembers);
    }

    public int size() {
        return members.size();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "#%d (%.6f, %.6f, %d photos)", getSequence(),
                getReferenceLatitude(), getReferenceLongitude(), members.size());
    }
}
