package org.pmcts.player.search;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to machine-specific configuration.
 */
public class MachineSpecificConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * The number of independent search trees (and therefore worker threads).  -1 means one per available vCPU.
     */
    NUMBER_OF_THREADS(8),

    /**
     * Limit on the number of playouts per search tree.  -1 for no limit.
     */
    MAX_ITERATIONS(10000),

    /**
     * Limit on the wall-clock time per search tree, in seconds.  -1 for no limit.
     */
    MAX_TIME("-1.0"),

    /**
     * Whether to log search diagnostics.
     */
    VERBOSE(false),

    /**
     * How worker trees are seeded: SHARED (every tree gets the same seed) or PER_WORKER.
     */
    SEED_POLICY(SeedPolicy.SHARED.name()),

    /**
     * Fixed master seed.  If not configured, every search uses a fresh seed.
     */
    SEED(null),

    /**
     * Board size for the benchmark game.
     */
    BOARD_SIZE(15);

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(String xiDefault)
    {
      mDefault = xiDefault;
    }

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
    }

    private CfgItem(boolean xiDefault)
    {
      mDefault = xiDefault ? "true" : "false";
    }
  }

  private static final Properties MACHINE_PROPERTIES = new Properties();
  static
  {
    // Computer is identified by the COMPUTERNAME environment variable (Windows) or HOSTNAME (Linux).
    String lComputerName = System.getenv("COMPUTERNAME");
    if (lComputerName == null)
    {
      lComputerName = System.getenv("HOSTNAME");
    }

    if (lComputerName != null)
    {
      try (InputStream lPropStream = new FileInputStream("data/cfg/" + lComputerName + ".properties"))
      {
        MACHINE_PROPERTIES.load(lPropStream);
      }
      catch (IOException lEx)
      {
        LOGGER.debug("No machine-specific configuration for " + lComputerName + " - using defaults");
      }
    }
    else
    {
      LOGGER.warn("Failed to identify computer name - no environment variable COMPUTERNAME or HOSTNAME");
    }
  }

  private MachineSpecificConfiguration()
  {
    // Private default constructor.
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return (MACHINE_PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault));
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    return Integer.parseInt(getCfgStr(xiKey));
  }

  /**
   * @return the specified floating point configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static double getCfgDouble(CfgItem xiKey)
  {
    return Double.parseDouble(getCfgStr(xiKey));
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey));
  }

  /**
   * Log all machine-specific configuration.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with machine-specific properties:");
    for (Entry<Object, Object> e : MACHINE_PROPERTIES.entrySet())
    {
      // Get the key.
      String lKey = (String)e.getKey();

      // Check that this is a known configuration parameter (and not a typo in the config file).
      try
      {
        CfgItem lItem = CfgItem.valueOf(lKey);
        LOGGER.info("\t" + lKey + " = " + e.getValue() + " (default: " + lItem.mDefault + ")");
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
      }
    }
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    MACHINE_PROPERTIES.setProperty(xiKey.toString(), xiValue);
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, boolean xiValue)
  {
    utOverrideCfgVal(xiKey, xiValue ? "true" : "false");
  }

  /**
   * UT-only method for reverting to the configured (or default) value.
   *
   * @param xiKey - the property to revert.
   */
  public static void utClearCfgVal(CfgItem xiKey)
  {
    MACHINE_PROPERTIES.remove(xiKey.toString());
  }
}
