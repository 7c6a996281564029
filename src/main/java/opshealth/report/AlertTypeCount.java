package opshealth.report;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class AlertTypeCount {
    private final AlertType type;
    private final int count;
}
