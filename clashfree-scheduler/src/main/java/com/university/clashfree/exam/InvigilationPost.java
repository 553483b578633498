package com.university.clashfree.exam;

import com.university.clashfree.domain.Exam;
import com.university.clashfree.domain.SlotRange;

/**
 * One invigilator position in one room of a placed exam.
 */
final class InvigilationPost {

    private final Exam exam;
    private final String roomId;
    private final SlotRange range;
    private final int index;

    InvigilationPost(Exam exam, String roomId, SlotRange range, int index) {
        this.exam = exam;
        this.roomId = roomId;
        this.range = range;
        this.index = index;
    }

    String getId() {
        return exam.getId() + "/" + roomId + "#" + index;
    }

    Exam getExam() {
        return exam;
    }

    String getRoomId() {
        return roomId;
    }

    SlotRange getRange() {
        return range;
    }

    @Override
    public String toString() {
        return getId();
    }
}
