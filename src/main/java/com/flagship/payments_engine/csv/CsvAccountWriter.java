package com.flagship.payments_engine.csv;

import com.flagship.payments_engine.account.AccountSnapshot;
import com.flagship.payments_engine.account.AccountsSnapshot;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes the final account states as CSV.
 *
 * The header is always written, even when there are no accounts.
 * Amounts use the canonical {@code Money} text.
 */
@Component
public class CsvAccountWriter {

    static final String[] HEADER = {"client", "available", "held", "total", "locked"};

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER)
            .setRecordSeparator("\n")
            .build();

    /**
     * @param snapshot accounts in client order
     * @param target destination; flushed, not closed
     */
    public void write(AccountsSnapshot snapshot, Writer target) throws IOException {
        CSVPrinter printer = new CSVPrinter(target, FORMAT);
        for (AccountSnapshot account : snapshot.getAccounts()) {
            printer.printRecord(
                    account.getClientId(),
                    account.getAvailable(),
                    account.getHeld(),
                    account.getTotal(),
                    account.isLocked());
        }
        printer.flush();
    }
}
