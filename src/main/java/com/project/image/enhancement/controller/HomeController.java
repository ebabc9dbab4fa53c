package com.project.image.enhancement.controller;

import com.project.image.enhancement.config.EnhancementProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Serves the upload form. Thin controller: just routes to a Thymeleaf view.
 */
@Controller
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    private final EnhancementProperties enhancementProperties;

    public HomeController(EnhancementProperties enhancementProperties) {
        this.enhancementProperties = enhancementProperties;
    }

    @GetMapping("/")
    public String index(Model model) {
        log.debug("Serving home page");
        model.addAttribute("defaultIntensity", enhancementProperties.defaultIntensity());
        return "index"; // templates/index.html
    }
}
