package com.eventalerts.alerter.domain.query;

import lombok.Builder;

@Builder(toBuilder = true)
public record EventFilter(
        int typeId,
        int statusId,
        String nameFilter,
        String nameExclude,
        int lookbackDays) {
}
