package com.keer.roombooking.selection;

import com.keer.roombooking.booking.model.TimeInterval;

import java.util.Optional;

/**
 * Drag-to-select state machine for one room's calendar.
 * <p>
 * Owns no durable data; it only screens candidates against the snapshot it was given so that
 * obviously doomed requests are never submitted. Admission remains the authority.
 */
public class RangeSelection {

    public enum State { IDLE, DRAGGING }

    private final CalendarGrid grid;
    private final AvailabilitySnapshot snapshot;

    private State state = State.IDLE;
    private GridCell anchor;
    private GridCell current;

    public RangeSelection(CalendarGrid grid, AvailabilitySnapshot snapshot) {
        this.grid = grid;
        this.snapshot = snapshot;
    }

    /**
     * Starts a drag on a free cell. Occupied, closed or off-grid cells leave the selection idle.
     *
     * @return whether a drag started
     */
    public boolean pointerDown(GridCell cell) {
        if (state != State.IDLE || !grid.contains(cell) || grid.isClosed(cell.date())) {
            return false;
        }
        if (snapshot.conflicts(grid.intervalOf(cell))) {
            return false;
        }
        anchor = cell;
        current = cell;
        state = State.DRAGGING;
        return true;
    }

    /**
     * Moves the free end of the selection. Cells on another day or outside the grid are ignored.
     */
    public void pointerMove(GridCell cell) {
        if (state != State.DRAGGING || !grid.contains(cell) || !cell.date().equals(anchor.date())) {
            return;
        }
        current = cell;
    }

    /**
     * Ends the drag and returns the candidate only when it is free in the snapshot.
     */
    public Optional<TimeInterval> pointerUp() {
        if (state != State.DRAGGING) {
            return Optional.empty();
        }
        TimeInterval candidate = grid.span(anchor, current);
        reset();
        return snapshot.conflicts(candidate) ? Optional.empty() : Optional.of(candidate);
    }

    public Optional<TimeInterval> candidate() {
        return state == State.DRAGGING ? Optional.of(grid.span(anchor, current)) : Optional.empty();
    }

    // Advisory feedback for rendering the drag preview.
    public boolean isCandidateConflicting() {
        return candidate().map(snapshot::conflicts).orElse(false);
    }

    public State getState() {
        return state;
    }

    private void reset() {
        state = State.IDLE;
        anchor = null;
        current = null;
    }
}
