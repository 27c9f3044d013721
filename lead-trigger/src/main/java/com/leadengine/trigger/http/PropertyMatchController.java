package com.leadengine.trigger.http;

import com.leadengine.api.dto.PropertyMatchDTO;
import com.leadengine.api.dto.PropertyNotifyResultDTO;
import com.leadengine.api.response.Response;
import com.leadengine.trigger.application.command.PropertyMatchNotifyApplicationService;
import com.leadengine.trigger.application.query.PropertyMatchQueryService;
import com.leadengine.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 房源匹配 API。
 */
@RestController
@RequestMapping("/api/v1/matches")
public class PropertyMatchController {

    private final PropertyMatchQueryService propertyMatchQueryService;
    private final PropertyMatchNotifyApplicationService propertyMatchNotifyApplicationService;

    public PropertyMatchController(PropertyMatchQueryService propertyMatchQueryService,
                                   PropertyMatchNotifyApplicationService propertyMatchNotifyApplicationService) {
        this.propertyMatchQueryService = propertyMatchQueryService;
        this.propertyMatchNotifyApplicationService = propertyMatchNotifyApplicationService;
    }

    @GetMapping("/properties/{id}")
    public Response<List<PropertyMatchDTO>> matchForProperty(@PathVariable("id") Long propertyId) {
        return success(propertyMatchQueryService.matchForProperty(propertyId));
    }

    @GetMapping("/leads/{id}")
    public Response<List<PropertyMatchDTO>> matchForLead(@PathVariable("id") Long leadId) {
        return success(propertyMatchQueryService.matchForLead(leadId));
    }

    @PostMapping("/properties/{id}/notify")
    public Response<PropertyNotifyResultDTO> notifyMatches(@PathVariable("id") Long propertyId) {
        PropertyMatchNotifyApplicationService.NotifyResult result =
                propertyMatchNotifyApplicationService.notifyMatches(propertyId);
        PropertyNotifyResultDTO dto = new PropertyNotifyResultDTO();
        dto.setPropertyId(result.propertyId());
        dto.setMatched(result.matched());
        dto.setNotified(result.notified());
        dto.setSkipped(result.skipped());
        dto.setFailed(result.failed());
        return success(dto);
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
