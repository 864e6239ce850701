package org.legalis.core;

/**
 * 地理区域的层级。
 */
public enum RegionType {
    COUNTRY,
    STATE,
    CITY,
    DISTRICT,
    POSTAL_CODE,
    CUSTOM
}
