package com.project.regimen.backend.config;

import com.project.regimen.backend.exception_handling.CustomAccessDeniedHandler;
import com.project.regimen.backend.exception_handling.CustomBasicAuthenticationEntryPoint;
import com.project.regimen.backend.service.AppUserService;
import com.project.regimen.backend.service.security.DatabaseUserDetailsService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.context.DelegatingSecurityContextRepository;
import org.springframework.security.web.context.HttpSessionSecurityContextRepository;
import org.springframework.security.web.context.RequestAttributeSecurityContextRepository;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableWebSecurity
public class SecurityConfiguration {

    @Value("${regimen.frontend-url:http://localhost:5173}")
    String frontendUrl;

    @Bean
    public SecurityFilterChain getSecurityFilterChain(HttpSecurity http) throws Exception {
        http.authorizeHttpRequests((config)-> {
            config.requestMatchers("/h2-console/**", "/isAuthenticated", "/register").permitAll();
            config.requestMatchers("/login", "/api/**").authenticated();
        });


        http.httpBasic(config-> {

            config.securityContextRepository(new DelegatingSecurityContextRepository(new HttpSessionSecurityContextRepository(), new RequestAttributeSecurityContextRepository()));

            //handles authentication exception
            config.authenticationEntryPoint(new CustomBasicAuthenticationEntryPoint());
        });


        //handles access denied exception
        http.exceptionHandling(config-> {
            config.accessDeniedHandler(new CustomAccessDeniedHandler());
        });


        //stores the security context in the request object as well as the http session object
        http.securityContext((config)-> {
            config.securityContextRepository(new DelegatingSecurityContextRepository(new HttpSessionSecurityContextRepository(), new RequestAttributeSecurityContextRepository()));
        });


        //TODO: re-enable CSRF once the frontend sends the XSRF-TOKEN header
        http.csrf(AbstractHttpConfigurer::disable);

        http.cors(Customizer.withDefaults());

        //NOTE: this is for h2 database urls to work fine
        http.headers(AbstractHttpConfigurer::disable);

        return http.build();
    }


    //configuring the CORS
    @Bean
    public WebMvcConfigurer corsConfigurer() {
        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/**")
                        .allowedOrigins(frontendUrl)
                        .allowedMethods("*")
                        .allowCredentials(true);
            }
        };
    }

    @Bean
    public UserDetailsService userDetailsService(AppUserService appUserService) {
        return new DatabaseUserDetailsService(appUserService);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
