package com.hybridgames.geometry;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PolytopeTest {
  private static final double DELTA = 1.0e-6;

  private static Polytope unitSquare() {
    return Polytope.box(new double[][] {{0, 1}, {0, 1}});
  }

  @Test
  void boxHasInscribedBallOfHalfWidth() {
    Polytope box = Polytope.box(new double[][] {{0, 2}, {0, 4}});
    assertEquals(1.0, box.chebyshevRadius(), DELTA);
    assertTrue(box.isFullDimensional());
    assertFalse(box.isEmpty());
  }

  @Test
  void degenerateBoxIsEmpty() {
    Polytope point = Polytope.box(new double[][] {{1, 1}, {0, 1}});
    assertTrue(point.isFeasible());
    assertTrue(point.isEmpty());
  }

  @Test
  void infeasibleSystemIsEmpty() {
    Polytope infeasible = Polytope.of(new double[][] {{1}, {-1}}, new double[] {0, -1});
    assertFalse(infeasible.isFeasible());
    assertTrue(infeasible.isEmpty());
    assertThrows(IllegalStateException.class, infeasible::boundingBox);
  }

  @Test
  void containsUsesTolerance() {
    Polytope square = unitSquare();
    assertTrue(square.contains(new double[] {0.5, 0.5}));
    assertTrue(square.contains(new double[] {1.0 + 1.0e-9, 0.0}));
    assertFalse(square.contains(new double[] {1.1, 0.5}));
  }

  @Test
  void intersectionOfTouchingBoxesHasNoVolume() {
    Polytope left = unitSquare();
    Polytope right = Polytope.box(new double[][] {{1, 2}, {0, 1}});
    assertFalse(left.intersect(right).isFullDimensional());
    Region overlapping = left.intersect(Polytope.box(new double[][] {{0.5, 2}, {0, 1}}));
    assertTrue(overlapping.isFullDimensional());
    assertArrayEquals(new double[] {0.5, 1.0}, overlapping.boundingBox()[0], DELTA);
  }

  @Test
  void differenceSplitsAlongFacets() {
    Polytope wide = Polytope.box(new double[][] {{0, 3}, {0, 1}});
    Region rest = wide.difference(unitSquare());
    assertTrue(rest.isFullDimensional());
    assertTrue(rest.contains(new double[] {2, 0.5}));
    assertFalse(rest.contains(new double[] {0.5, 0.5}));
    double[][] bounds = rest.boundingBox();
    assertArrayEquals(new double[] {1, 3}, bounds[0], DELTA);
    assertArrayEquals(new double[] {0, 1}, bounds[1], DELTA);

    assertTrue(unitSquare().difference(wide).isEmpty());
  }

  @Test
  void differenceWithUnionFoldsLeft() {
    Polytope wide = Polytope.box(new double[][] {{0, 2}, {0, 1}});
    Region covering = Regions.union(unitSquare(), Polytope.box(new double[][] {{1, 2}, {0, 1}}));
    assertTrue(wide.difference(covering).isEmpty());
  }

  @Test
  void universeIsUnboundedAndFullDimensional() {
    Polytope universe = Polytope.universe(2);
    assertTrue(universe.isFullDimensional());
    double[][] bounds = universe.boundingBox();
    assertEquals(Double.NEGATIVE_INFINITY, bounds[0][0]);
    assertEquals(Double.POSITIVE_INFINITY, bounds[1][1]);
    assertEquals(unitSquare(), universe.intersect(unitSquare()));
  }

  @Test
  void halfSpaceBoundingBoxIsHalfInfinite() {
    Polytope halfLine = Polytope.of(new double[][] {{1}}, new double[] {3});
    double[][] bounds = halfLine.boundingBox();
    assertEquals(Double.NEGATIVE_INFINITY, bounds[0][0]);
    assertEquals(3.0, bounds[0][1], DELTA);
  }

  @Test
  void rejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> Polytope.box(new double[][] {{1, 0}}));
    assertThrows(IllegalArgumentException.class, () -> Polytope.of(new double[][] {{1, 0}}, new double[] {1, 2}));
    assertThrows(IllegalArgumentException.class, () -> unitSquare().contains(new double[] {0.5}));
  }

  @Test
  void zeroRows() {
    Polytope trivial = Polytope.of(new double[][] {{0, 0}, {1, 0}}, new double[] {2, 1});
    assertEquals(1, trivial.constraints());
    assertThrows(IllegalArgumentException.class,
        () -> Polytope.of(new double[][] {{0, 0}}, new double[] {-1}));
  }

  @Test
  void equalityIsStructural() {
    assertEquals(unitSquare(), Polytope.of(unitSquare().matrix(), unitSquare().offsets()));
    assertEquals(unitSquare().hashCode(), Polytope.box(new double[][] {{0, 1}, {0, 1}}).hashCode());
  }
}
