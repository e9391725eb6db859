package com.dcruver.filetaxonomy.nlp;

import lombok.Value;

/**
 * Date hint found in a file name. Any field may be null; at most one kind of hint is usually set.
 */
@Value
public class DateInfo {
    Integer year;
    Integer quarter;
    Integer month;

    public static DateInfo ofYear(int year) {
        return new DateInfo(year, null, null);
    }

    public static DateInfo ofQuarter(int quarter) {
        return new DateInfo(null, quarter, null);
    }

    public static DateInfo ofMonth(int month) {
        return new DateInfo(null, null, month);
    }
}
