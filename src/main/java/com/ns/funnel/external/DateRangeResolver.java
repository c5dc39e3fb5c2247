package com.ns.funnel.external;

import com.ns.funnel.model.DateRange;

import java.time.ZoneId;

public interface DateRangeResolver {

    ResolvedDateRange resolve(DateRange range, ZoneId zone);
}
