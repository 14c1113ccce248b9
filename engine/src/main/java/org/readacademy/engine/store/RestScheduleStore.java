package org.readacademy.engine.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.readacademy.engine.api.RequestMapper;
import org.readacademy.engine.api.dto.CommitBatchDto;
import org.readacademy.engine.api.dto.ConsultationRequestDto;
import org.readacademy.engine.api.dto.SlotDto;
import org.readacademy.engine.domain.exception.CommitFailedException;
import org.readacademy.engine.domain.exception.SchedulingException;
import org.readacademy.engine.domain.model.ConsultationRequest;
import org.readacademy.engine.domain.model.TimeSlot;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.Body;
import retrofit2.http.GET;
import retrofit2.http.POST;
import retrofit2.http.Query;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Retrofit-based store talking to the academy's schedule backend.
 * Reads degrade to empty lists on failure; commits never degrade and surface
 * as {@link CommitFailedException}.
 */
public final class RestScheduleStore implements ScheduleStore {

    private static final Logger LOG = Logger.getLogger(RestScheduleStore.class.getName());

    private final ScheduleApiService api;

    public RestScheduleStore(String baseUrl, String apiKey) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS);
        if (apiKey != null && !apiKey.isEmpty()) {
            clientBuilder.addInterceptor(new AuthInterceptor(apiKey));
        }

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(new ObjectMapper()))
                .client(clientBuilder.build())
                .build();

        this.api = retrofit.create(ScheduleApiService.class);
    }

    @Override
    public List<TimeSlot> loadSlots() {
        List<SlotDto> dtos = execute(api.getSlots(), "GET /v1/slots");
        if (dtos == null) {
            return Collections.emptyList();
        }
        List<TimeSlot> slots = new ArrayList<>(dtos.size());
        for (SlotDto dto : dtos) {
            try {
                slots.add(RequestMapper.toSlot(dto));
            } catch (IllegalArgumentException e) {
                LOG.log(Level.WARNING, "[STORE] Ignoring malformed slot record", e);
            }
        }
        return slots;
    }

    @Override
    public List<ConsultationRequest> loadPendingRequests() {
        List<ConsultationRequestDto> dtos = execute(api.getConsultations("pending"), "GET /v1/consultations");
        if (dtos == null) {
            return Collections.emptyList();
        }
        List<String> rejected = new ArrayList<>();
        List<ConsultationRequest> requests = RequestMapper.toRequests(dtos, rejected);
        for (String reason : rejected) {
            LOG.warning(() -> "[STORE] " + reason);
        }
        return requests;
    }

    @Override
    public void submit(ConsultationRequest request) {
        Response<Void> response;
        try {
            response = api.submit(RequestMapper.toDto(request)).execute();
        } catch (IOException e) {
            throw new SchedulingException("[STORE] POST /v1/consultations failed: " + e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            throw new SchedulingException(String.format("[STORE] POST /v1/consultations rejected %s: %d %s",
                    request.getRequestId(), response.code(), response.message()));
        }
    }

    @Override
    public void commit(ScheduleBatch batch) {
        CommitBatchDto body = RequestMapper.toDto(batch);
        Response<Void> response;
        try {
            response = api.commit(body).execute();
        } catch (IOException e) {
            throw new CommitFailedException("[STORE] POST /v1/schedule/commits failed: " + e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            throw new CommitFailedException(String.format("[STORE] POST /v1/schedule/commits rejected: %d %s",
                    response.code(), response.message()), null);
        }
        LOG.fine(() -> "[STORE] Committed " + batch);
    }

    /**
     * Execute a Retrofit call and return the result, or null on failure.
     */
    private <T> T execute(Call<T> call, String description) {
        try {
            Response<T> response = call.execute();
            if (response.isSuccessful()) {
                return response.body();
            }
            LOG.warning(() -> String.format("[STORE] %s failed: %d %s",
                    description, response.code(), response.message()));
            return null;
        } catch (IOException e) {
            LOG.log(Level.WARNING, "[STORE] " + description + " error", e);
            return null;
        }
    }

    /**
     * Retrofit service interface for the schedule backend.
     */
    interface ScheduleApiService {
        @GET("v1/slots")
        Call<List<SlotDto>> getSlots();

        @GET("v1/consultations")
        Call<List<ConsultationRequestDto>> getConsultations(@Query("status") String status);

        @POST("v1/consultations")
        Call<Void> submit(@Body ConsultationRequestDto request);

        @POST("v1/schedule/commits")
        Call<Void> commit(@Body CommitBatchDto batch);
    }
}
