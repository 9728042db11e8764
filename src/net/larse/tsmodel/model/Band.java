package net.larse.tsmodel.model;

/**
 * The spectral bands and indices a pixel time series can carry.
 *
 * <p>Each band knows the name it is exported under and which way it moves when vegetation
 * improves: +1 if an increase in the value is an improvement (NDVI, NBR, nir, ...), -1 if an
 * increase indicates loss (visible and SWIR reflectance, brightness, NDSI).
 */
public enum Band {
  BLUE("blue", -1),
  GREEN("green", -1),
  RED("red", -1),
  NIR("nir", 1),
  SWIR1("swir1", -1),
  SWIR2("swir2", -1),
  NDVI("NDVI", 1),
  NBR("NBR", 1),
  NDMI("NDMI", 1),
  NDSI("NDSI", -1),
  BRIGHTNESS("brightness", -1),
  GREENNESS("greenness", 1),
  WETNESS("wetness", 1),
  TC_ANGLE_BG("tcAngleBG", 1);

  private final String bandName;
  private final int improvementDirection;

  Band(String bandName, int improvementDirection) {
    this.bandName = bandName;
    this.improvementDirection = improvementDirection;
  }

  /** The name used as prefix for every exported value of this band. */
  public String bandName() {
    return bandName;
  }

  public int improvementDirection() {
    return improvementDirection;
  }

  /**
   * Looks a band up by its exported name (case sensitive, as the names are).
   *
   * @throws IllegalArgumentException if no band carries that name.
   */
  public static Band fromName(String name) {
    for (Band band : values()) {
      if (band.bandName.equals(name)) {
        return band;
      }
    }
    throw new IllegalArgumentException("Unknown band: " + name);
  }
}
