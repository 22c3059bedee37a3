package sample.threedsecure.transaction;

public class TransactionNotFoundException extends Exception {

    private static final long serialVersionUID = 1L;

    public TransactionNotFoundException(String transactionId) {
        super("Transaction not found: " + transactionId);
    }
}
