package com.thingtalk.manifest;

/**
 * Module names and keys of the legacy JSON manifest format.
 */
public final class ManifestConstants {

    private ManifestConstants() {} // Utility class

    // ==================== Modules ====================

    /** Loader used when a class imports no loader mixin. */
    public static final String DEFAULT_LOADER = "org.thingpedia.v2";

    public static final String CONFIG_PREFIX = "org.thingpedia.config.";
    public static final String CONFIG_NONE = CONFIG_PREFIX + "none";
    public static final String CONFIG_FORM = CONFIG_PREFIX + "form";
    public static final String CONFIG_BASIC_AUTH = CONFIG_PREFIX + "basic_auth";
    public static final String CONFIG_OAUTH2 = CONFIG_PREFIX + "oauth2";
    public static final String CONFIG_CUSTOM_OAUTH = CONFIG_PREFIX + "custom_oauth";
    public static final String CONFIG_INTERACTIVE = CONFIG_PREFIX + "interactive";
    public static final String CONFIG_BUILTIN = CONFIG_PREFIX + "builtin";
    public static final String CONFIG_DISCOVERY_PREFIX = CONFIG_PREFIX + "discovery.";
    public static final String CONFIG_DISCOVERY_BLUETOOTH = CONFIG_DISCOVERY_PREFIX + "bluetooth";
    public static final String CONFIG_DISCOVERY_UPNP = CONFIG_DISCOVERY_PREFIX + "upnp";

    // ==================== Facets ====================

    public static final String FACET_LOADER = "loader";
    public static final String FACET_CONFIG = "config";

    // ==================== Encoded discovery kinds ====================

    public static final String BLUETOOTH_PREFIX = "bluetooth-";
    public static final String BLUETOOTH_UUID_PREFIX = "bluetooth-uuid-";
    public static final String BLUETOOTH_CLASS_PREFIX = "bluetooth-class-";
    public static final String UPNP_PREFIX = "upnp-";

    // ==================== Categories ====================

    public static final String CATEGORY_SYSTEM = "system";
    public static final String CATEGORY_DATA = "data";
    public static final String CATEGORY_PHYSICAL = "physical";
    public static final String CATEGORY_ONLINE = "online";

    /** Poll interval written for functions that cannot be monitored. */
    public static final int NOT_MONITORABLE = -1;
}
