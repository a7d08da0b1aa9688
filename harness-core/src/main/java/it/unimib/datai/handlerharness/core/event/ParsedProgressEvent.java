package it.unimib.datai.handlerharness.core.event;

import it.unimib.datai.handlerharness.common.model.ProgressEvent;

import java.util.List;

public record ParsedProgressEvent(ProgressEvent event, List<ContractWarning> warnings) {
    public ParsedProgressEvent {
        warnings = List.copyOf(warnings);
    }
}
