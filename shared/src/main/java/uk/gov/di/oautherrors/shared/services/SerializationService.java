package uk.gov.di.oautherrors.shared.services;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oautherrors.shared.serialization.Json;

import static java.util.Objects.isNull;

public class SerializationService implements Json {

    private static SerializationService INSTANCE;
    private static final Logger LOG = LogManager.getLogger(SerializationService.class);

    private final Gson gson;

    public SerializationService() {
        this(new GsonBuilder());
    }

    public SerializationService(GsonBuilder gsonBuilder) {
        this.gson = gsonBuilder.create();
    }

    @Override
    public String writeValueAsString(Object object) throws JsonException {
        try {
            return gson.toJson(object);
        } catch (JsonIOException | IllegalArgumentException e) {
            LOG.error("Error during JSON serialization", e);
            throw new JsonException(e);
        }
    }

    public static SerializationService getInstance() {
        if (isNull(INSTANCE)) {
            INSTANCE = new SerializationService();
        }
        return INSTANCE;
    }
}
