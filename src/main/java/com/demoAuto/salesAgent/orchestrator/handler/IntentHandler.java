package com.demoAuto.salesAgent.orchestrator.handler;

import com.demoAuto.salesAgent.orchestrator.model.HandlerRequest;
import com.demoAuto.salesAgent.orchestrator.model.HandlerResponse;
import com.demoAuto.salesAgent.orchestrator.model.Intent;

/**
 * One handler per {@link Intent}. The family is closed: adding a handler means adding an intent.
 *
 * Handlers recover from capability failures themselves and always return a reply.
 */
public sealed interface IntentHandler permits GeneralHandler, CatalogHandler, FinanceHandler {

    Intent intent();

    HandlerResponse handle(HandlerRequest request);
}
