package net.larse.tsmodel.model;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class TrajectoryTest {
  Trajectory trajectory = Trajectory.of(new int[] {1990, 1995, 2000},
      new double[] {100, 50, 150});

  @Test
  public void testSegmentIndex() {
    assertEquals(0, trajectory.segmentIndex(1980));
    assertEquals(0, trajectory.segmentIndex(1990));
    assertEquals(0, trajectory.segmentIndex(1994));
    assertEquals(1, trajectory.segmentIndex(1995));
    assertEquals(1, trajectory.segmentIndex(2000));
    assertEquals(1, trajectory.segmentIndex(2010));
  }

  @Test
  public void testValueAt() {
    assertEquals(100, trajectory.valueAt(1985), 0);
    assertEquals(80, trajectory.valueAt(1992), 1e-12);
    assertEquals(50, trajectory.valueAt(1995), 1e-12);
    assertEquals(100, trajectory.valueAt(1997.5), 1e-12);
    assertEquals(150, trajectory.valueAt(2005), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testYearsMustIncrease() {
    new Trajectory(ImmutableList.of(new Vertex(2000, 1), new Vertex(2000, 2)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNeedsTwoVertices() {
    Trajectory.of(new int[] {2000}, new double[] {1});
  }

  @Test
  public void testSelectionRuleNames() {
    for (SelectionRule rule : SelectionRule.values()) {
      assertEquals(rule, SelectionRule.fromName(rule.ruleName()));
    }
    assertEquals(SelectionRule.MOST_GRADUAL, SelectionRule.fromName("mostGradual"));
  }
}
