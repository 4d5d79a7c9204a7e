package com.ludora.paymentcore.client;

import com.ludora.paymentcore.dto.CheckoutPage;
import com.ludora.paymentcore.dto.CheckoutPageRequest;
import com.ludora.paymentcore.dto.ProviderStatusResult;
import com.ludora.paymentcore.exception.ProviderUnavailableException;

/**
 * Push + pull payment provider: a hosted checkout page whose outcome arrives by webhook
 * and can also be queried on demand.
 */
public interface PaymentProviderClient {

    /** Provider name recorded on transactions and webhook logs. */
    String name();

    /**
     * Creates a hosted payment page.
     *
     * @throws ProviderUnavailableException on transport errors or a provider-side error answer
     */
    CheckoutPage createPaymentPage(CheckoutPageRequest request);

    /**
     * Looks up the current status of a payment page by its correlation key.
     *
     * @throws ProviderUnavailableException on transport errors or an unreadable answer
     */
    ProviderStatusResult lookupStatus(String pageRequestUid);
}
