package org.smarttask.allocator.api;

import okhttp3.OkHttpClient;
import org.smarttask.allocator.api.dto.MemberDto;
import org.smarttask.allocator.api.dto.TaskDto;
import org.smarttask.allocator.api.dto.TeamStateDto;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.Body;
import retrofit2.http.GET;
import retrofit2.http.POST;
import retrofit2.http.PUT;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Retrofit-based implementation of TeamApiClient.
 */
public final class TeamApiClientImpl implements TeamApiClient {

    private static final Logger LOG = Logger.getLogger(TeamApiClientImpl.class.getName());

    private final TeamApiService api;

    public TeamApiClientImpl(String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(JsonMapperFactory.create()))
                .client(client)
                .build();

        this.api = retrofit.create(TeamApiService.class);
    }

    @Override
    public List<MemberDto> getMembers() {
        return execute(api.getMembers(), "GET /v1/members");
    }

    @Override
    public List<TaskDto> getTasks() {
        return execute(api.getTasks(), "GET /v1/tasks");
    }

    @Override
    public MemberDto createMember(MemberDto member) {
        return execute(api.createMember(member), "POST /v1/members");
    }

    @Override
    public TaskDto createTask(TaskDto task) {
        return execute(api.createTask(task), "POST /v1/tasks");
    }

    @Override
    public boolean saveState(TeamStateDto state) {
        return executeVoid(api.saveState(state), "PUT /v1/team/state");
    }

    /**
     * Execute a Retrofit call and return the result.
     */
    private <T> T execute(Call<T> call, String description) {
        try {
            Response<T> response = call.execute();
            if (response.isSuccessful()) {
                return response.body();
            }
            LOG.warning(() -> String.format("[API] %s failed: %d %s",
                    description, response.code(), response.message()));
            return null;
        } catch (Exception e) {
            LOG.log(Level.WARNING, "[API] " + description + " error", e);
            return null;
        }
    }

    /**
     * Execute a Retrofit call that returns void.
     */
    private boolean executeVoid(Call<Void> call, String description) {
        try {
            Response<Void> response = call.execute();
            if (!response.isSuccessful()) {
                LOG.warning(() -> String.format("[API] %s failed: %d %s",
                        description, response.code(), response.message()));
                return false;
            }
            return true;
        } catch (Exception e) {
            LOG.log(Level.WARNING, "[API] " + description + " error", e);
            return false;
        }
    }

    /**
     * Retrofit service interface for the team API.
     */
    interface TeamApiService {
        @GET("v1/members")
        Call<List<MemberDto>> getMembers();

        @GET("v1/tasks")
        Call<List<TaskDto>> getTasks();

        @POST("v1/members")
        Call<MemberDto> createMember(@Body MemberDto member);

        @POST("v1/tasks")
        Call<TaskDto> createTask(@Body TaskDto task);

        @PUT("v1/team/state")
        Call<Void> saveState(@Body TeamStateDto state);
    }
}
