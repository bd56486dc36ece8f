package com.chaski.deliveryservice.enums;

public enum PackageSize {
    SMALL,       // under 5kg, fits in a bag
    MEDIUM,      // 5-20kg, box
    LARGE,       // 20-50kg
    EXTRA_LARGE  // over 50kg
}
