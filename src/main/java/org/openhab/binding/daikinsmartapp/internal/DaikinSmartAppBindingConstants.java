package org.openhab.binding.daikinsmartapp.internal;

public final class DaikinSmartAppBindingConstants {

        public static final String BINDING_ID = "daikinsmartapp";

        // Config parameters
        public static final String CONFIG_USERNAME = "username";
        public static final String CONFIG_PASSWORD = "password";
        public static final String CONFIG_CLIENT_ID = "clientId";
        public static final String CONFIG_CLIENT_SECRET = "clientSecret";
        public static final String CONFIG_CLIENT_UUID = "clientUuid";
        public static final String CONFIG_AUTH_MODE = "authMode";
        public static final String CONFIG_REGION = "region";
        public static final String CONFIG_ENDPOINTS_OVERRIDE = "endpointsOverride";
        public static final String CONFIG_REFRESH = "refresh";
        public static final String CONFIG_CONFIRMATION_TIMEOUT = "confirmationTimeout";
        public static final String CONFIG_FAILURE_THRESHOLD = "failureThreshold";
        public static final String CONFIG_SESSION_LIFETIME = "sessionLifetime";
        public static final String CONFIG_SESSION_SAFETY_MARGIN = "sessionSafetyMargin";
        public static final String CONFIG_MAX_INVALIDATIONS = "maxInvalidations";
        public static final String CONFIG_INVALIDATION_WINDOW = "invalidationWindow";
        public static final String CONFIG_STORE_PATH = "storePath";

        // Defaults
        public static final String DEFAULT_REGION = "default";
        public static final int DEFAULT_REFRESH_SECONDS = 30;
        public static final int MIN_REFRESH_SECONDS = 10;
        public static final int DEFAULT_CONFIRMATION_TIMEOUT_SECONDS = 90;
        public static final int DEFAULT_FAILURE_THRESHOLD = 3;
        public static final int DEFAULT_SESSION_LIFETIME_MINUTES = 50;
        public static final int DEFAULT_SESSION_SAFETY_MARGIN_SECONDS = 60;
        public static final int DEFAULT_MAX_INVALIDATIONS = 3;
        public static final int DEFAULT_INVALIDATION_WINDOW_SECONDS = 300;

        // Token kinds presented as bearer
        public static final String AUTH_MODE_ID_TOKEN = "id_token";
        public static final String AUTH_MODE_ACCESS_TOKEN = "access_token";

        // Result codes carried in the "rsc" field
        public static final int RSC_OK = 2000;
        public static final int RSC_ACCEPTED = 2004;
        public static final int RSC_NOT_FOUND = 4004;

        // Multi-request operations
        public static final int OP_READ = 2;
        public static final int OP_WRITE = 3;

        // dsiot paths
        public static final String PATH_EDGES = "/dsiot/edges";
        public static final String PATH_EDGES_EXPAND = "/dsiot/edges?expand";
        public static final String STATUS_NODE = "adr_0100.dgc_status";

        // Status tree nodes
        public static final String NODE_DGC_STATUS = "dgc_status";
        public static final String NODE_STATUS_ROOT = "e_1002";
        public static final String NODE_MODE_GROUP = "e_3001";
        public static final String NODE_FAN_GROUP = "e_3003";
        public static final String NODE_POWER_GROUP = "e_A002";
        public static final String NODE_SENSOR_GROUP = "e_A00B";
        public static final String NODE_ADAPTER_DESCRIPTION = "adp_d";
        public static final String NODE_ADAPTER_INFO = "adp_i";

        // Status keys, flattened as "<group>.<param>"
        public static final String KEY_POWER = "e_A002.p_01";
        public static final String KEY_MODE = "e_3001.p_01";
        public static final String KEY_TARGET_TEMPERATURE = "e_3001.p_02";
        public static final String KEY_FAN_CODE = "e_3003.p_2D";
        public static final String KEY_ROOM_TEMPERATURE = "e_A00B.p_01";
        public static final String KEY_ROOM_HUMIDITY = "e_A00B.p_02";
        public static final String KEY_SENSOR_TEMPERATURE_1 = "e_A00B.p_05";
        public static final String KEY_SENSOR_TEMPERATURE_2 = "e_A00B.p_06";

        public static final String POWER_OFF = "00";
        public static final String POWER_ON = "01";
        public static final String DEFAULT_FAN_CODE = "02";

        private DaikinSmartAppBindingConstants() {
                // utility class
        }
}
