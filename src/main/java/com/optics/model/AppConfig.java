package com.optics.model;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    private static final String KEY_SIMTEL_PATH = "simtel_path";
    private static final String KEY_SIMTEL_CONFIG = "simtel_config_file";
    private static final String KEY_OUTPUT_DIR = "output_dir";
    private static final String KEY_WORKERS = "worker_threads";
    private static final String KEY_TOOL_TIMEOUT = "tool_timeout_minutes";
    private static final String KEY_USE_RX = "use_rx";
    private static final String KEY_TELESCOPE = "telescope_name";
    private static final String KEY_SITE = "site";
    private static final String KEY_ALTITUDE = "site_altitude";
    private static final String KEY_FOCAL_LENGTH = "focal_length";
    private static final String KEY_MIRROR_FOCAL_LENGTH = "mirror_focal_length";
    private static final String KEY_MIRRORS = "number_of_mirrors";
    private static final String KEY_TRANSMISSION = "telescope_transmission";

    // sim_telarray installation (rx and sim_telarray binaries live below it)
    public static Path getSimtelPath() { return Paths.get(prefs.get(KEY_SIMTEL_PATH, "/workdir/sim_telarray")); }
    public static void setSimtelPath(String v) { prefs.put(KEY_SIMTEL_PATH, v); }

    public static String getSimtelConfigFile() { return prefs.get(KEY_SIMTEL_CONFIG, ""); }
    public static void setSimtelConfigFile(String v) { prefs.put(KEY_SIMTEL_CONFIG, v); }

    public static Path getOutputDirectory() {
        return Paths.get(prefs.get(KEY_OUTPUT_DIR, Paths.get(System.getProperty("user.home"), "optics-suite-output").toString()));
    }
    public static void setOutputDirectory(String v) { prefs.put(KEY_OUTPUT_DIR, v); }

    public static int getWorkerThreads() { return prefs.getInt(KEY_WORKERS, 1); }
    public static void setWorkerThreads(int v) { prefs.putInt(KEY_WORKERS, v); }

    public static long getToolTimeoutMinutes() { return prefs.getLong(KEY_TOOL_TIMEOUT, 60); }
    public static void setToolTimeoutMinutes(long v) { prefs.putLong(KEY_TOOL_TIMEOUT, v); }

    public static boolean isUseRx() { return prefs.getBoolean(KEY_USE_RX, false); }
    public static void setUseRx(boolean v) { prefs.putBoolean(KEY_USE_RX, v); }

    // Telescope model parameters (lengths in cm, altitude in m)
    public static String getTelescopeName() { return prefs.get(KEY_TELESCOPE, "LST-1"); }
    public static void setTelescopeName(String v) { prefs.put(KEY_TELESCOPE, v); }

    public static String getSite() { return prefs.get(KEY_SITE, "North"); }
    public static void setSite(String v) { prefs.put(KEY_SITE, v); }

    public static double getSiteAltitude() { return prefs.getDouble(KEY_ALTITUDE, 2147.0); }
    public static void setSiteAltitude(double v) { prefs.putDouble(KEY_ALTITUDE, v); }

    public static double getFocalLength() { return prefs.getDouble(KEY_FOCAL_LENGTH, 2800.0); }
    public static void setFocalLength(double v) { prefs.putDouble(KEY_FOCAL_LENGTH, v); }

    public static double getMirrorFocalLength() { return prefs.getDouble(KEY_MIRROR_FOCAL_LENGTH, 2800.0); }
    public static void setMirrorFocalLength(double v) { prefs.putDouble(KEY_MIRROR_FOCAL_LENGTH, v); }

    public static int getNumberOfMirrors() { return prefs.getInt(KEY_MIRRORS, 198); }
    public static void setNumberOfMirrors(int v) { prefs.putInt(KEY_MIRRORS, v); }

    public static String getTelescopeTransmission() { return prefs.get(KEY_TRANSMISSION, "0.969 0 0 0 0"); }
    public static void setTelescopeTransmission(String v) { prefs.put(KEY_TRANSMISSION, v); }

    public static TelescopeOptics getTelescopeOptics() {
        return new TelescopeOptics(getTelescopeName(), getSite(), getFocalLength(), getMirrorFocalLength(),
                getNumberOfMirrors(), TelescopeTransmission.parse(getTelescopeTransmission()));
    }
}
