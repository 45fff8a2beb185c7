package org.pak.brefv.core;

/**
 * The compiled-in tag table. {@link #REGISTRY} is fully populated when this class is initialized.
 */
public final class WellKnownTags {
    public static final String TIMESTAMPED_BYTES = "keelson.TimestampedBytes";
    public static final String TIMESTAMPED_STRING = "keelson.TimestampedString";
    public static final String TIMESTAMPED_FLOAT = "keelson.TimestampedFloat";
    public static final String TIMESTAMPED_INT = "keelson.TimestampedInt";

    public static final String RAW = "raw";

    public static final TagRegistry REGISTRY = TagRegistry.builder()
            .tag(RAW, TIMESTAMPED_BYTES)
            .tag("raw_json", TIMESTAMPED_STRING)
            .tag("raw_nmea0183", TIMESTAMPED_STRING)
            .tag("raw_nmea2000", TIMESTAMPED_BYTES)
            .tag("raw_lwe450", TIMESTAMPED_BYTES)

            .tag("configuration_json", TIMESTAMPED_STRING)
            .tag("log_message", "foxglove.Log")

            .tag("sensor_status", "keelson.SensorStatus")
            .tag("network_status", "keelson.NetworkStatus")
            .tag("simulation_status", "keelson.SimulationStatus")
            .tag("roc_status", "keelson.ROCStatus")

            .tag("frame_transform", "foxglove.FrameTransform")

            .tag("location_fix", "foxglove.LocationFix")
            .tag("location_fix_accuracy_horizontal_m", TIMESTAMPED_FLOAT)
            .tag("location_fix_accuracy_vertical_m", TIMESTAMPED_FLOAT)
            .tag("location_fix_satellites_used", TIMESTAMPED_INT)
            .tag("location_fix_quality", "keelson.LocationFixQuality")
            .tag("location_fix_hdop", TIMESTAMPED_FLOAT)
            .tag("location_fix_vdop", TIMESTAMPED_FLOAT)
            .tag("location_fix_pdop", TIMESTAMPED_FLOAT)

            .tag("vessel_outline_geojson", "keelson.TimestampedGeoJSON")

            .tag("no_go_zone_geojson", "keelson.TimestampedGeoJSON")
            .tag("navigable_waters_geojson", "keelson.TimestampedGeoJSON")
            .tag("waypoint_geojson", "keelson.TimestampedGeoJSON")

            .tag("rate_of_turn_degpm", TIMESTAMPED_FLOAT)

            .tag("heading_true_north_deg", TIMESTAMPED_FLOAT)
            .tag("heading_magnetic_deg", TIMESTAMPED_FLOAT)

            .tag("course_over_ground_deg", TIMESTAMPED_FLOAT)

            .tag("speed_over_ground_knots", TIMESTAMPED_FLOAT)
            .tag("speed_through_water_knots", TIMESTAMPED_FLOAT)

            .tag("vessel_name", TIMESTAMPED_STRING)
            .tag("vessel_type", "keelson.VesselType")
            .tag("vessel_imo_number", TIMESTAMPED_INT)
            .tag("vessel_mmsi_number", TIMESTAMPED_INT)
            .tag("vessel_call_sign", TIMESTAMPED_STRING)
            .tag("vessel_flag_code", "keelson.FlagCode")
            .tag("vessel_nav_status", "keelson.VesselNavStatus")

            .tag("length_over_all_m", TIMESTAMPED_FLOAT)
            .tag("breadth_over_all_m", TIMESTAMPED_FLOAT)

            .tag("draught_mean_m", TIMESTAMPED_FLOAT)
            .tag("draught_max_m", TIMESTAMPED_FLOAT)
            .tag("draught_stern_m", TIMESTAMPED_FLOAT)
            .tag("draught_bow_m", TIMESTAMPED_FLOAT)
            .tag("draught_midship_m", TIMESTAMPED_FLOAT)

            .tag("wheel_position_pct", TIMESTAMPED_FLOAT)
            .tag("lever_position_pct", TIMESTAMPED_FLOAT)

            .tag("propeller_rate_rpm", TIMESTAMPED_FLOAT)
            .tag("propeller_pitch_pct", TIMESTAMPED_FLOAT)

            .tag("rudder_angle_deg", TIMESTAMPED_FLOAT)

            .tag("engine_rate_rpm", TIMESTAMPED_FLOAT)
            .tag("engine_temperature_celsius", TIMESTAMPED_FLOAT)
            .tag("engine_fuel_level_pct", TIMESTAMPED_FLOAT)
            .tag("engine_fuel_rate_lph", TIMESTAMPED_FLOAT)
            .tag("engine_fuel_consumed_l", TIMESTAMPED_FLOAT)
            .tag("engine_oil_pressure_psi", TIMESTAMPED_FLOAT)
            .tag("engine_oil_temperature_celsius", TIMESTAMPED_FLOAT)
            .tag("engine_coolant_temperature_celsius", TIMESTAMPED_FLOAT)
            .tag("engine_coolant_pressure_psi", TIMESTAMPED_FLOAT)

            .tag("battery_type", TIMESTAMPED_STRING)
            .tag("battery_state_of_charge_pct", TIMESTAMPED_FLOAT)
            .tag("battery_voltage_volt", TIMESTAMPED_FLOAT)
            .tag("battery_current_amp", TIMESTAMPED_FLOAT)
            .tag("battery_temperature_celsius", TIMESTAMPED_FLOAT)
            .tag("battery_min_voltage_volt", TIMESTAMPED_FLOAT)
            .tag("battery_max_voltage_volt", TIMESTAMPED_FLOAT)
            .tag("battery_capacity_amph", TIMESTAMPED_FLOAT)

            .tag("air_temperature_celsius", TIMESTAMPED_FLOAT)
            .tag("air_relative_humidity_pct", TIMESTAMPED_FLOAT)
            .tag("water_temperature_celsius", TIMESTAMPED_FLOAT)
            .tag("water_salinity_ppt", TIMESTAMPED_FLOAT)
            .tag("water_speed_of_sound_mps", TIMESTAMPED_FLOAT)
            .tag("true_wind_direction_deg", TIMESTAMPED_FLOAT)
            .tag("true_wind_angle_deg", TIMESTAMPED_FLOAT)
            .tag("true_wind_speed_mps", TIMESTAMPED_FLOAT)
            .tag("apparent_wind_angle_deg", TIMESTAMPED_FLOAT)
            .tag("apparent_wind_speed_mps", TIMESTAMPED_FLOAT)

            .tag("image_raw", "foxglove.RawImage")
            .tag("image_compressed", "foxglove.CompressedImage")
            .tag("video_compressed", "foxglove.CompressedVideo")
            .tag("laser_scan", "foxglove.LaserScan")
            .tag("point_cloud", "foxglove.PointCloud")

            .tag("alarm", "keelson.Alarm")
            .tag("audio", "keelson.Audio")
            .tag("imu_reading", "keelson.ImuReading")
            .tag("radar_spoke", "keelson.RadarSpoke")
            .tag("radar_sweep", "keelson.RadarSweep")

            .tag("target_type", "keelson.TargetType")
            .tag("target_bearing_magnetic_deg", TIMESTAMPED_FLOAT)
            .tag("target_bearing_north_deg", TIMESTAMPED_FLOAT)
            .tag("target_bearing_relative_deg", TIMESTAMPED_FLOAT)
            .tag("target_cpa_m", TIMESTAMPED_FLOAT)
            .tag("target_tcpa_s", TIMESTAMPED_FLOAT)
            .tag("target_bcr_m", TIMESTAMPED_FLOAT)
            .tag("target_bct_s", TIMESTAMPED_FLOAT)
            .build();

    private WellKnownTags() {
    }
}
