package net.larse.tsmodel.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The result of a harmonic regression over one pixel: a model per band, and per band the model
 * value at every input observation (also for observations where the band was missing).
 *
 * <p>Bands that could not be fit have no model, a reason in {@link #failures()}, and NaN fitted
 * values.
 */
public final class HarmonicFit {
  private final ImmutableMap<Band, HarmonicModel> models;
  private final ImmutableMap<Band, double[]> fitted;
  private final ImmutableMap<Band, String> failures;

  public HarmonicFit(Map<Band, HarmonicModel> models, Map<Band, double[]> fitted,
      Map<Band, String> failures) {
    Preconditions.checkArgument(Sets.intersection(models.keySet(), failures.keySet()).isEmpty(),
        "a band is both fit and failed");
    Preconditions.checkArgument(
        Sets.union(models.keySet(), failures.keySet()).equals(fitted.keySet()),
        "fitted values cover different bands");
    this.models = ImmutableMap.copyOf(models);
    this.failures = ImmutableMap.copyOf(failures);
    Map<Band, double[]> copy = new EnumMap<>(Band.class);
    for (Map.Entry<Band, double[]> e : fitted.entrySet()) {
      copy.put(e.getKey(), e.getValue().clone());
    }
    this.fitted = ImmutableMap.copyOf(copy);
  }

  /** All bands of the fit, failed or not. */
  public ImmutableSet<Band> bands() {
    return fitted.keySet();
  }

  /** The models of the bands that were fit. */
  public ImmutableMap<Band, HarmonicModel> models() {
    return models;
  }

  /** Why each failed band could not be fit. */
  public ImmutableMap<Band, String> failures() {
    return failures;
  }

  public boolean isFit(Band band) {
    return models.containsKey(band);
  }

  public Optional<HarmonicModel> findModel(Band band) {
    return Optional.ofNullable(models.get(band));
  }

  /** The model of band, which must have been fit. */
  public HarmonicModel model(Band band) {
    HarmonicModel model = models.get(band);
    if (model == null) {
      throw new IllegalArgumentException(failures.containsKey(band)
          ? "band " + band + " could not be fit: " + failures.get(band)
          : "band " + band + " was not configured");
    }
    return model;
  }

  /** The fitted value of band at each input observation, in input order. */
  public double[] fitted(Band band) {
    double[] values = fitted.get(band);
    Preconditions.checkArgument(values != null, "band %s was not configured", band);
    return values.clone();
  }

  /** All coefficients of the fit bands as one flat record. */
  public Map<String, Double> toMap() {
    Map<String, Double> out = new LinkedHashMap<>();
    for (HarmonicModel model : models.values()) {
      out.putAll(model.toMap());
    }
    return out;
  }
}
