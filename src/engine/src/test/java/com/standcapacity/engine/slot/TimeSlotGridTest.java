package com.standcapacity.engine.slot;

import static com.standcapacity.engine.TestReference.DAY;
import static com.standcapacity.engine.TestReference.at;
import static com.standcapacity.engine.TestReference.base;
import static com.standcapacity.engine.TestReference.settings;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.standcapacity.engine.error.ConfigException;
import com.standcapacity.engine.reference.AircraftType;
import com.standcapacity.engine.reference.OperationalSettings;
import com.standcapacity.engine.reference.ReferenceSnapshot;
import java.time.LocalTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class TimeSlotGridTest {

  @Test
  void buildsContiguousSlotsAndBlocks() {
    TimeSlotGrid grid = TimeSlotGrid.build(DAY, settings());

    assertEquals(68, grid.slotCount());
    assertEquals(17, grid.blocks().size());
    assertThat(grid.slot(0).start()).isEqualTo(at("06:00"));
    assertThat(grid.slot(67).end()).isEqualTo(at("23:00"));
    for (int i = 1; i < grid.slotCount(); i++) {
      assertThat(grid.slot(i).start()).isEqualTo(grid.slot(i - 1).end());
    }
    assertThat(grid.blocks().get(1).slots()).isEqualTo(new SlotRange(4, 8));
    assertThat(grid.slot(16).label()).isEqualTo("10:00");
  }

  @Test
  void lastBlockMayBeShort() {
    OperationalSettings settings =
        new OperationalSettings(60, 4, LocalTime.of(6, 0), LocalTime.of(12, 0), 0, ZoneOffset.UTC);

    TimeSlotGrid grid = TimeSlotGrid.build(DAY, settings);

    assertThat(grid.blocks()).hasSize(2);
    assertThat(grid.blocks().get(1).slots().size()).isEqualTo(2);
  }

  @Test
  void rejectsEndBeforeStart() {
    OperationalSettings settings =
        new OperationalSettings(15, 4, LocalTime.of(10, 0), LocalTime.of(9, 0), 15, ZoneOffset.UTC);

    assertThatThrownBy(() -> TimeSlotGrid.build(DAY, settings)).isInstanceOf(ConfigException.class);
  }

  @Test
  void rejectsDurationThatDoesNotDivideWindow() {
    OperationalSettings settings =
        new OperationalSettings(25, 4, LocalTime.of(6, 0), LocalTime.of(23, 0), 15, ZoneOffset.UTC);

    assertThatThrownBy(() -> TimeSlotGrid.build(DAY, settings))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("does not evenly divide");
  }

  @Test
  void midnightEndCoversRestOfDay() {
    OperationalSettings settings =
        new OperationalSettings(30, 2, LocalTime.of(6, 0), LocalTime.MIDNIGHT, 15, ZoneOffset.UTC);

    TimeSlotGrid grid = TimeSlotGrid.build(DAY, settings);

    assertThat(grid.windowMinutes()).isEqualTo(18 * 60);
    assertThat(grid.slot(grid.slotCount() - 1).end()).isEqualTo(DAY.plusDays(1).atStartOfDay().atOffset(ZoneOffset.UTC));
  }

  @Test
  void slotIndexOfTimestamp() {
    TimeSlotGrid grid = TimeSlotGrid.build(DAY, settings());

    assertThat(grid.slotIndexOf(at("06:00"))).hasValue(0);
    assertThat(grid.slotIndexOf(at("10:07"))).hasValue(16);
    assertThat(grid.slotIndexOf(at("22:59"))).hasValue(67);
    assertThat(grid.slotIndexOf(at("05:59"))).isEmpty();
    assertThat(grid.slotIndexOf(at("23:00"))).isEmpty();
  }

  @Test
  void slotIndexHonoursOffsets() {
    TimeSlotGrid grid = TimeSlotGrid.build(DAY, settings());

    assertThat(grid.slotIndexOf(at("10:00").withOffsetSameInstant(ZoneOffset.ofHours(2))))
        .hasValue(16);
  }

  @Test
  void slotRangeRoundsOutward() {
    TimeSlotGrid grid = TimeSlotGrid.build(DAY, settings());

    assertThat(grid.slotRange(new Interval(10, 40))).hasValue(new SlotRange(0, 3));
    assertThat(grid.toInterval(new SlotRange(0, 3))).isEqualTo(new Interval(0, 45));
  }

  @Test
  void alignedWindowOccupiesExactlyItsSlots() {
    TimeSlotGrid grid = TimeSlotGrid.build(DAY, settings());

    SlotRange range = grid.slotRange(new Interval(225, 285)).orElseThrow();

    assertThat(range.size()).isEqualTo(4);
    assertThat(range.first()).isEqualTo(15);
  }

  @Test
  void slotRangeIsEmptyOutsideWindow() {
    TimeSlotGrid grid = TimeSlotGrid.build(DAY, settings());

    assertThat(grid.slotRange(new Interval(-15, 30))).isEmpty();
    assertThat(grid.slotRange(new Interval(1000, 1030))).isEmpty();
  }

  @Test
  void occupancyAddsTurnaroundAndGap() {
    ReferenceSnapshot snapshot = base().build();
    OccupancyCalculator occupancy = new OccupancyCalculator(snapshot);

    assertThat(occupancy.departure(240, "A320")).isEqualTo(new Interval(195, 255));
    assertThat(occupancy.arrival(240, "A320")).isEqualTo(new Interval(225, 285));
    assertThat(occupancy.rotation(240, 300)).isEqualTo(new Interval(225, 315));
  }

  @Test
  void missingTurnaroundRuleIsConfigError() {
    ReferenceSnapshot snapshot = base()
        .aircraftType(new AircraftType("CRJ9", "CRJ9", "CRJ-900", 24.9, 36.2, "C"))
        .build();

    assertThatThrownBy(() -> new OccupancyCalculator(snapshot).arrival(240, "CRJ9"))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("CRJ9");
  }

  @Test
  void gapSeparationBetweenWindows() {
    Interval first = new Interval(0, 60);

    assertThat(first.conflictsWith(new Interval(60, 90), 15)).isTrue();
    assertThat(first.conflictsWith(new Interval(75, 90), 15)).isFalse();
    assertThat(first.overlaps(new Interval(60, 90))).isFalse();
  }
}
