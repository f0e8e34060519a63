package com.linlay.calculatoragent.calculator;

import com.linlay.calculatoragent.calculator.handler.OperationHandler;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a {@link ParameterSet} to the handler registered for its {@link Category}.
 */
public class OperationDispatcher {

    private final Map<Category, OperationHandler> handlers = new EnumMap<>(Category.class);

    public OperationDispatcher(List<OperationHandler> handlers) {
        for (OperationHandler handler : handlers) {
            OperationHandler previous = this.handlers.put(handler.category(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for category " + handler.category().value());
            }
        }
        for (Category category : Category.values()) {
            if (!this.handlers.containsKey(category)) {
                throw new IllegalStateException("No handler registered for category " + category.value());
            }
        }
    }

    public OperationResult dispatch(Category category, ParameterSet params) {
        return handlers.get(category).handle(params == null ? ParameterSet.empty() : params);
    }
}
