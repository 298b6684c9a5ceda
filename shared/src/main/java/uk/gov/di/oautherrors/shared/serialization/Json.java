package uk.gov.di.oautherrors.shared.serialization;

public interface Json {
    String writeValueAsString(Object object) throws JsonException;

    class JsonException extends Exception {
        public JsonException(Exception e) {
            super(e);
        }
    }
}
